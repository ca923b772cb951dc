package com.kuzur.script;

import java.io.UncheckedIOException;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kuzur.script.parser.Value;

/**
 * JSON view of a run's globals, printed by {@code kuzur --dump-globals}.
 * Integral numbers become JSON integers, functions become their
 * {@code <func name>} string form.
 */
public final class GlobalsJson {

    private static final ObjectMapper om = new ObjectMapper();

    private GlobalsJson() {}

    public static ObjectNode toJson(Map<String, Value> globals) {
        ObjectNode root = om.createObjectNode();
        for (Map.Entry<String, Value> e : globals.entrySet()) {
            String key = e.getKey();
            Value v = e.getValue();
            switch (v.getType()) {
                case NUMBER: {
                    double d = v.asNumber();
                    if (d == Math.rint(d) && Math.abs(d) < 1e15) root.put(key, (long) d);
                    else if (Double.isNaN(d) || Double.isInfinite(d)) root.put(key, v.display());
                    else root.put(key, d);
                    break;
                }
                case BOOL:
                    root.put(key, v.asBool());
                    break;
                case STRING:
                    root.put(key, v.asString());
                    break;
                case FUNC:
                    root.put(key, v.display());
                    break;
                default:
                    root.putNull(key);
            }
        }
        return root;
    }

    public static String pretty(Map<String, Value> globals) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(globals));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
