package com.example.spellgrid.config;

import com.example.spellgrid.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Lenient accessors over the raw maps SnakeYAML produces. Missing or
 * malformed values fall back to the supplied default.
 */
final class YamlValues {

    private static final Logger logger = LoggerFactory.getLogger(YamlValues.class);

    private YamlValues() {}

    static int getInt(Map<String, Object> map, String key, int def) {
        if (map == null) return def;
        Object val = map.get(key);
        if (val == null) return def;
        if (val instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(val.toString().trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring malformed integer for '{}': {}", key, val);
            return def;
        }
    }

    static double getDouble(Map<String, Object> map, String key, double def) {
        if (map == null) return def;
        Object val = map.get(key);
        if (val == null) return def;
        if (val instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(val.toString().trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring malformed number for '{}': {}", key, val);
            return def;
        }
    }

    static String getString(Map<String, Object> map, String key) {
        if (map == null) return null;
        Object val = map.get(key);
        return val == null ? null : val.toString();
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> getMap(Map<String, Object> map, String key) {
        if (map == null) return null;
        Object val = map.get(key);
        if (val instanceof Map) {
            return (Map<String, Object>) val;
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> getMapList(Map<String, Object> map, String key) {
        if (map == null) return Collections.emptyList();
        Object val = map.get(key);
        if (!(val instanceof List)) return Collections.emptyList();
        List<Map<String, Object>> out = new ArrayList<>();
        for (Object o : (List<Object>) val) {
            if (o instanceof Map) {
                out.add((Map<String, Object>) o);
            }
        }
        return out;
    }

    /** Parse a two-element [x, y] list, or null if the value is not one. */
    static Position toPosition(Object val) {
        if (!(val instanceof List<?> list) || list.size() != 2) return null;
        if (list.get(0) instanceof Number x && list.get(1) instanceof Number y) {
            return Position.of(x.intValue(), y.intValue());
        }
        return null;
    }

    static Position getPosition(Map<String, Object> map, String key, Position def) {
        if (map == null || !map.containsKey(key)) return def;
        Position p = toPosition(map.get(key));
        if (p == null) {
            logger.warn("Ignoring malformed position for '{}': {}", key, map.get(key));
            return def;
        }
        return p;
    }

    /** Parse a list of [x, y] pairs; returns null when the key is absent. */
    static List<Position> getPositionList(Map<String, Object> map, String key) {
        if (map == null || !(map.get(key) instanceof List<?> list)) return null;
        List<Position> out = new ArrayList<>();
        for (Object o : list) {
            Position p = toPosition(o);
            if (p != null) {
                out.add(p);
            } else {
                logger.warn("Skipping malformed position in '{}': {}", key, o);
            }
        }
        return out;
    }
}
