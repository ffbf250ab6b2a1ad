package com.rally.leaguesync.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One JSON object of a league document with lenient field access. Scraped values arrive as
 * strings or numbers interchangeably.
 */
public class SourceRecord {

    private static final int MAX_PAYLOAD = 4000;

    private final int rowNumber;
    private final Map<String, Object> fields;

    public SourceRecord(int rowNumber, Map<String, Object> fields) {
        this.rowNumber = rowNumber;
        this.fields = fields;
    }

    public int getRowNumber() { return rowNumber; }

    public String text(String key) {
        Object v = fields.get(key);
        if (v == null || v instanceof Map) return null;
        String s = v.toString().trim();
        return s.isEmpty() ? null : s;
    }

    public String firstText(String... keys) {
        for (String key : keys) {
            String v = text(key);
            if (v != null) return v;
        }
        return null;
    }

    public String require(String key) {
        String v = text(key);
        if (v == null) throw new InvalidRecordException("Missing required field: " + key);
        return v;
    }

    public Integer integer(String key) {
        return toInteger(fields.get(key));
    }

    /** Integer inside a nested object, e.g. {@code matches.won}. */
    public Integer integer(String objectKey, String key) {
        Object nested = fields.get(objectKey);
        if (!(nested instanceof Map<?, ?> map)) return null;
        return toInteger(map.get(key));
    }

    /** Objects of a nested array, sharing this record's row number. Non-object entries are dropped. */
    public List<SourceRecord> records(String key) {
        Object v = fields.get(key);
        if (!(v instanceof List<?> list)) return List.of();
        List<SourceRecord> nested = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                Map<String, Object> copy = new LinkedHashMap<>();
                map.forEach((k, val) -> copy.put(String.valueOf(k), val));
                nested.add(new SourceRecord(rowNumber, copy));
            }
        }
        return nested;
    }

    public Double decimal(String key) {
        Object v = fields.get(key);
        if (v instanceof Number n) return n.doubleValue();
        if (v == null) return null;
        String s = v.toString().replace("%", "").replace(",", "").trim();
        if (s.isEmpty()) return null;
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public String payload() {
        String s = fields.toString();
        return s.length() > MAX_PAYLOAD ? s.substring(0, MAX_PAYLOAD) : s;
    }

    // null for values that are not finite or do not fit an int
    private static Integer toInteger(Object v) {
        if (v == null) return null;
        double d;
        if (v instanceof Number n) {
            d = n.doubleValue();
        } else {
            String s = v.toString().trim();
            if (s.isEmpty()) return null;
            try {
                d = Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (!Double.isFinite(d)) return null;
        long rounded = Math.round(d);
        if (rounded < Integer.MIN_VALUE || rounded > Integer.MAX_VALUE) return null;
        return (int) rounded;
    }
}
