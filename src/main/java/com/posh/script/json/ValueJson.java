package com.posh.script.json;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.posh.script.parser.PropertyMap;
import com.posh.script.parser.Value;

/**
 * Value ⇄ JSON tree conversion.
 *
 * Whole numbers are written as integers. Functions and blocks are written as their display
 * text. Values nested deeper than the depth limit are written as display strings.
 */
public final class ValueJson {

    private static final ObjectMapper om = new ObjectMapper();
    private static final ObjectMapper pretty = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private ValueJson() {}

    public static JsonNode toJson(Value v) {
        return toJson(v, Integer.MAX_VALUE);
    }

    public static JsonNode toJson(Value v, int depth) {
        switch (v.type) {
            case NULL:
                return nodes.nullNode();
            case BOOL:
                return nodes.booleanNode(v.asBool());
            case NUMBER: {
                double d = v.asNumber();
                if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 9.0e15) {
                    return nodes.numberNode((long) d);
                }
                return nodes.numberNode(d);
            }
            case STRING:
                return nodes.textNode(v.asString());
            case LIST: {
                if (depth <= 0) return nodes.textNode(v.toDisplayString());
                ArrayNode arr = nodes.arrayNode();
                for (Value item : v.asList()) arr.add(toJson(item, depth - 1));
                return arr;
            }
            case RECORD: {
                if (depth <= 0) return nodes.textNode(v.toDisplayString());
                ObjectNode obj = nodes.objectNode();
                for (Map.Entry<String, Value> e : v.asRecord().entrySet()) {
                    obj.set(e.getKey(), toJson(e.getValue(), depth - 1));
                }
                return obj;
            }
            default:
                return nodes.textNode(v.toDisplayString());
        }
    }

    public static Value fromJson(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) return Value.nil();
        if (n.isBoolean()) return Value.bool(n.booleanValue());
        if (n.isNumber()) return Value.number(n.doubleValue());
        if (n.isTextual()) return Value.string(n.textValue());
        if (n.isArray()) {
            List<Value> items = new ArrayList<>(n.size());
            for (JsonNode e : n) items.add(fromJson(e));
            return Value.list(items);
        }
        if (n.isObject()) {
            PropertyMap<Value> props = new PropertyMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = n.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                props.put(e.getKey(), fromJson(e.getValue()));
            }
            return Value.record(props);
        }
        return Value.string(n.asText());
    }

    public static String write(JsonNode n, boolean compress) throws JsonProcessingException {
        return compress ? om.writeValueAsString(n) : pretty.writeValueAsString(n);
    }

    public static JsonNode read(String text) throws JsonProcessingException {
        return om.readTree(text);
    }
}
