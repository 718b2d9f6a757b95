package com.gdin.inspection.waterleak.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public final class CsvUtil {
    private CsvUtil() {}

    /** 逗号分隔，双引号包裹，引号加倍 */
    public static String toCsv(List<Map<String, Object>> rows, List<String> headers) {
        return toCsv(rows, ",", '"', true, headers);
    }

    /**
     * @param rows 行数据
     * @param delimiter 分隔符
     * @param escapeChar 包裹字段内双引号的转义字符，RFC 4180 为 '"'
     * @param replaceNewlines 是否将 \r \n 替换为空格
     * @param headers 指定列顺序；为 null 时沿用第一行 key 顺序
     */
    public static String toCsv(
            List<Map<String, Object>> rows,
            String delimiter,
            char escapeChar,
            boolean replaceNewlines,
            List<String> headers
    ) {
        List<String> cols;
        if (headers != null && !headers.isEmpty()) {
            cols = new ArrayList<>(headers);
        } else if (rows != null && !rows.isEmpty()) {
            cols = new ArrayList<>(rows.get(0).keySet());
        } else {
            return "";
        }

        List<String> lines = new ArrayList<>();
        lines.add(cols.stream()
                .map(h -> escapeField(h, delimiter, escapeChar, replaceNewlines))
                .collect(Collectors.joining(delimiter)));

        if (rows != null) {
            for (Map<String, Object> row : rows) {
                lines.add(cols.stream()
                        .map(h -> escapeField(valToString(row.get(h)), delimiter, escapeChar, replaceNewlines))
                        .collect(Collectors.joining(delimiter)));
            }
        }
        return String.join("\n", lines) + "\n";
    }

    private static String valToString(Object v) {
        if (v == null) return "";
        return String.valueOf(v);
    }

    /**
     * 含分隔符、引号或换行的字段用双引号包裹，内部双引号前加 escapeChar
     */
    private static String escapeField(String s, String delimiter, char escapeChar, boolean replaceNewlines) {
        if (s == null) return "";
        String t = s;
        if (replaceNewlines) {
            t = t.replace("\r", " ").replace("\n", " ");
        }

        boolean needQuote = t.contains(delimiter) || t.contains("\"") || t.contains("\n") || t.contains("\r");
        if (!needQuote) return t;

        StringBuilder out = new StringBuilder(t.length() + 8);
        out.append('"');
        for (int i = 0; i < t.length(); i++) {
            char c = t.charAt(i);
            if (c == '"') {
                out.append(escapeChar);
            }
            out.append(c);
        }
        out.append('"');
        return out.toString();
    }
}
