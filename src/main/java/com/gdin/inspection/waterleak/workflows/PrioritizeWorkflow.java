package com.gdin.inspection.waterleak.workflows;

import com.gdin.inspection.waterleak.models.DefectProbability;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
public class PrioritizeWorkflow {

    /**
     * 按概率降序；List.sort 稳定，概率相同保持输入顺序
     */
    public List<DefectProbability> run(List<DefectProbability> probabilities) {
        List<DefectProbability> sorted = new ArrayList<>(probabilities == null ? List.of() : probabilities);
        sorted.sort(Comparator.comparingDouble(DefectProbability::getProbability).reversed());
        return sorted;
    }
}
