package com.gdin.inspection.waterleak.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;
import java.util.Objects;

/**
 * 属性过滤条件，对应 Gremlin 的 has(key, P.gte(value)) 等。
 * 数值按 double 比较，其他类型只支持 EQ。
 */
@Value
@Jacksonized
@Builder
public class PropertyPredicate {

    public enum Op {
        EQ, GT, GTE, LT, LTE
    }

    @JsonProperty("key")
    String key;

    @JsonProperty("op")
    Op op;

    @JsonProperty("value")
    Object value;

    public static PropertyPredicate eq(String key, Object value) {
        return new PropertyPredicate(key, Op.EQ, value);
    }

    public static PropertyPredicate gte(String key, Number value) {
        return new PropertyPredicate(key, Op.GTE, value);
    }

    public static PropertyPredicate lte(String key, Number value) {
        return new PropertyPredicate(key, Op.LTE, value);
    }

    public boolean test(Map<String, Object> properties) {
        if (properties == null || !properties.containsKey(key)) return false;
        Object actual = properties.get(key);
        if (actual instanceof Number && value instanceof Number) {
            int cmp = Double.compare(((Number) actual).doubleValue(), ((Number) value).doubleValue());
            switch (op) {
                case EQ:
                    return cmp == 0;
                case GT:
                    return cmp > 0;
                case GTE:
                    return cmp >= 0;
                case LT:
                    return cmp < 0;
                case LTE:
                    return cmp <= 0;
                default:
                    return false;
            }
        }
        return op == Op.EQ && Objects.equals(actual, value);
    }
}
