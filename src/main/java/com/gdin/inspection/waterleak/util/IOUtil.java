package com.gdin.inspection.waterleak.util;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;

@Slf4j
public class IOUtil {
    private static final ObjectMapper simpleMapper = new ObjectMapper();

    static {
        simpleMapper.registerModule(new JavaTimeModule());
        // 避免写成时间戳（否则 Instant 会变成 long）
        simpleMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // 资产数据可能带有额外字段
        simpleMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static ObjectMapper mapper() {
        return simpleMapper;
    }

    public static String jsonSerialize(Object obj) throws JsonProcessingException {
        return jsonSerialize(obj, false);
    }

    public static String jsonSerialize(Object obj, boolean pretty) throws JsonProcessingException {
        if (obj == null) return null;
        if (pretty) return simpleMapper.writerWithDefaultPrettyPrinter().writeValueAsString(obj);
        else return simpleMapper.writeValueAsString(obj);
    }

    public static <T> T jsonDeserialize(InputStream is, Class<T> clazz) throws IOException {
        return simpleMapper.readValue(is, clazz);
    }

    public static <T> T jsonDeserialize(InputStream is, TypeReference<T> type) throws IOException {
        return simpleMapper.readValue(is, type);
    }

    public static <T> T jsonDeserialize(String content, Class<T> clazz) throws JsonProcessingException {
        return content == null ? null : simpleMapper.readValue(content, clazz);
    }

    /**
     * 将JSON字符串解析为指定类型的列表
     * @return 解析后的对象列表，解析失败返回空列表
     */
    @SuppressWarnings("unchecked")
    public static <T> List<T> parseList(String json, Class<? extends T> elementType) {
        try {
            if (StrUtil.isBlank(json)) {
                return Collections.emptyList();
            }
            JavaType type = simpleMapper.getTypeFactory()
                    .constructCollectionType(List.class, elementType);
            return (List<T>) simpleMapper.readValue(json, type);
        } catch (Exception e) {
            log.error("JSON解析失败: {}", json, e);
            return Collections.emptyList();
        }
    }
}
