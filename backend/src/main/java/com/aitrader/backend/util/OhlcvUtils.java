package com.aitrader.backend.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;

/**
 * Trimming for stored OHLCV payloads. Snapshots hold either parallel series
 * ({@code {"open": [...], "close": [...]}}) or a flat list of candles.
 */
public final class OhlcvUtils {

    private OhlcvUtils() {
    }

    /**
     * Keeps the last {@code points} entries of every series.
     */
    public static JsonNode tail(ObjectMapper mapper, JsonNode ohlcv, int points) {
        if (ohlcv == null || ohlcv.isNull() || ohlcv.isMissingNode()) {
            return mapper.createObjectNode();
        }
        if (ohlcv.isArray()) {
            return tailArray(mapper, (ArrayNode) ohlcv, points);
        }
        if (!ohlcv.isObject()) {
            return mapper.createObjectNode();
        }
        ObjectNode result = mapper.createObjectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = ohlcv.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            result.set(field.getKey(), value.isArray() ? tailArray(mapper, (ArrayNode) value, points) : value);
        }
        return result;
    }

    private static ArrayNode tailArray(ObjectMapper mapper, ArrayNode values, int points) {
        ArrayNode result = mapper.createArrayNode();
        for (int i = Math.max(0, values.size() - points); i < values.size(); i++) {
            result.add(values.get(i));
        }
        return result;
    }
}
