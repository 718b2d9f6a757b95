package com.gdin.inspection.waterleak.feed;

import com.gdin.inspection.waterleak.models.Junction;
import com.gdin.inspection.waterleak.models.PipelineSegment;

import java.util.List;

/**
 * 资产管理数据源，只读。
 */
public interface AssetFeed {

    List<Junction> junctions();

    List<PipelineSegment> segments();
}
