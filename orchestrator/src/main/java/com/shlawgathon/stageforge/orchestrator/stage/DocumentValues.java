package com.shlawgathon.stageforge.orchestrator.stage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed views over the loosely typed JSON values a working document holds,
 * whether a stage produced them or they were read back from a checkpoint.
 */
final class DocumentValues {

    private DocumentValues() {
    }

    static List<Map<String, Object>> mapList(Object value) {
        List<Map<String, Object>> maps = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> map) {
                    Map<String, Object> copy = new LinkedHashMap<>();
                    map.forEach((key, entry) -> copy.put(String.valueOf(key), entry));
                    maps.add(copy);
                }
            }
        }
        return maps;
    }

    static List<String> stringList(Object value) {
        List<String> strings = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    strings.add(item.toString());
                }
            }
        }
        return strings;
    }

    static String string(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value == null ? "" : value.toString();
    }
}
