package com.gdin.inspection.waterleak.feed;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gdin.inspection.waterleak.exception.MalformedInputException;
import com.gdin.inspection.waterleak.exception.RiskException;
import com.gdin.inspection.waterleak.models.Junction;
import com.gdin.inspection.waterleak.models.PipelineSegment;
import com.gdin.inspection.waterleak.util.IOUtil;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;

/**
 * 从 JSON 文件读取管网资产：
 * <pre>{ "junctions": [...], "segments": [...] }</pre>
 * 首次访问时加载并缓存。
 */
@Slf4j
public class JsonAssetFeed implements AssetFeed {

    private final Resource resource;
    private volatile Document document;

    public JsonAssetFeed(Resource resource) {
        this.resource = resource;
    }

    @Override
    public List<Junction> junctions() {
        List<Junction> j = load().getJunctions();
        return j == null ? Collections.emptyList() : Collections.unmodifiableList(j);
    }

    @Override
    public List<PipelineSegment> segments() {
        List<PipelineSegment> s = load().getSegments();
        return s == null ? Collections.emptyList() : Collections.unmodifiableList(s);
    }

    private Document load() {
        Document d = document;
        if (d != null) return d;
        synchronized (this) {
            if (document == null) {
                try (InputStream is = resource.getInputStream()) {
                    document = IOUtil.jsonDeserialize(is, Document.class);
                } catch (RiskException e) {
                    throw e;
                } catch (IOException e) {
                    // PipelineSegment 构造时的校验异常会被 Jackson 包装
                    for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
                        if (cause instanceof RiskException) throw (RiskException) cause;
                    }
                    throw new MalformedInputException("cannot read asset feed " + resource.getDescription() + ": " + e.getMessage());
                }
                log.info("资产数据加载完成：{} junctions={}, segments={}", resource.getDescription(),
                        document.getJunctions() == null ? 0 : document.getJunctions().size(),
                        document.getSegments() == null ? 0 : document.getSegments().size());
            }
            return document;
        }
    }

    @Data
    public static class Document {
        @JsonProperty("junctions")
        private List<Junction> junctions;

        @JsonProperty("segments")
        private List<PipelineSegment> segments;
    }
}
