package com.posh.script.parser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Immutable runtime value. Lists and records are copied on construction and only
 * exposed through read-only views, so values never share mutable state.
 */
public final class Value {
    public enum Type { NULL, BOOL, NUMBER, STRING, RECORD, LIST, FUNCTION, BLOCK }

    private static final Pattern NUMERIC =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private static final Value NULL = new Value(Type.NULL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value nil() { return NULL; }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value string(String s) { return s == null ? NULL : new Value(Type.STRING, s); }
    public static Value function(UserFunction f) { return new Value(Type.FUNCTION, f); }
    public static Value block(DeferredBlock b) { return new Value(Type.BLOCK, b); }

    public static Value list(List<Value> items) {
        List<Value> copy = new ArrayList<>(items.size());
        for (Value v : items) copy.add(v == null ? NULL : v);
        return new Value(Type.LIST, Collections.unmodifiableList(copy));
    }

    public static Value list(Value... items) {
        return list(java.util.Arrays.asList(items));
    }

    public static Value record(PropertyMap<Value> props) {
        return new Value(Type.RECORD, new PropertyMap<>(props));
    }

    /** Builds a record from an ordered map; keys differing only by case collapse, last wins. */
    public static Value record(Map<String, Value> props) {
        PropertyMap<Value> pm = new PropertyMap<>();
        for (Map.Entry<String, Value> e : props.entrySet()) {
            pm.put(e.getKey(), e.getValue() == null ? NULL : e.getValue());
        }
        return new Value(Type.RECORD, pm);
    }

    /** Wraps a plain Java object: null, Boolean, Number or String. */
    public static Value of(Object o) {
        if (o == null) return NULL;
        if (o instanceof Value) return (Value) o;
        if (o instanceof Boolean) return bool((Boolean) o);
        if (o instanceof Number) return number(((Number) o).doubleValue());
        if (o instanceof String) return string((String) o);
        throw new IllegalArgumentException("Unsupported literal: " + o.getClass().getName());
    }

    public Type getType() { return type; }

    public boolean isNull() { return type == Type.NULL; }

    public boolean asBool() {
        if (type != Type.BOOL) throw ScriptRuntimeException.typeMismatch("asBool", "BOOL", type.name());
        return (Boolean) value;
    }

    public double asNumber() {
        if (type != Type.NUMBER) throw ScriptRuntimeException.typeMismatch("asNumber", "NUMBER", type.name());
        return (Double) value;
    }

    public String asString() {
        if (type != Type.STRING) throw ScriptRuntimeException.typeMismatch("asString", "STRING", type.name());
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        if (type != Type.LIST) throw ScriptRuntimeException.typeMismatch("asList", "LIST", type.name());
        return (List<Value>) value;
    }

    /** Read-only snapshot of the record's properties in insertion order. */
    public Map<String, Value> asRecord() {
        return props().toMap();
    }

    public UserFunction asFunction() {
        if (type != Type.FUNCTION) throw ScriptRuntimeException.typeMismatch("asFunction", "FUNCTION", type.name());
        return (UserFunction) value;
    }

    public DeferredBlock asBlock() {
        if (type != Type.BLOCK) throw ScriptRuntimeException.typeMismatch("asBlock", "BLOCK", type.name());
        return (DeferredBlock) value;
    }

    @SuppressWarnings("unchecked")
    private PropertyMap<Value> props() {
        if (type != Type.RECORD) throw ScriptRuntimeException.typeMismatch("asRecord", "RECORD", type.name());
        return (PropertyMap<Value>) value;
    }

    // -------------------------
    // Conversions
    // -------------------------

    public boolean toBoolean() {
        switch (type) {
            case NULL: return false;
            case BOOL: return (Boolean) value;
            case NUMBER: return (Double) value != 0.0;
            case STRING: return !((String) value).isEmpty();
            case LIST: return !asList().isEmpty();
            default: return true;
        }
    }

    /** Number as-is, numeric-looking strings parsed; anything else is empty. */
    public OptionalDouble toNumber() {
        if (type == Type.NUMBER) return OptionalDouble.of((Double) value);
        if (type == Type.STRING) {
            String s = ((String) value).trim();
            if (NUMERIC.matcher(s).matches()) return OptionalDouble.of(Double.parseDouble(s));
        }
        return OptionalDouble.empty();
    }

    /** Case-insensitive property lookup; only records have properties. */
    public Optional<Value> getProperty(String name) {
        if (type != Type.RECORD) return Optional.empty();
        return Optional.ofNullable(props().get(name));
    }

    public String toDisplayString() {
        switch (type) {
            case NULL: return "";
            case BOOL: return (Boolean) value ? "True" : "False";
            case NUMBER: return formatNumber((Double) value);
            case STRING: return (String) value;
            case RECORD: {
                StringBuilder sb = new StringBuilder("@{");
                PropertyMap<Value> p = props();
                boolean first = true;
                for (String k : p.keys()) {
                    if (!first) sb.append("; ");
                    first = false;
                    sb.append(k).append('=').append(p.get(k).toDisplayString());
                }
                return sb.append('}').toString();
            }
            case LIST: {
                StringBuilder sb = new StringBuilder();
                List<Value> items = asList();
                for (int i = 0; i < items.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(items.get(i).toDisplayString());
                }
                return sb.toString();
            }
            case FUNCTION: return "function " + asFunction().name;
            case BLOCK: return asBlock().source;
            default: return "";
        }
    }

    static String formatNumber(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "Infinity" : "-Infinity";
        if (d == Math.rint(d) && Math.abs(d) < 1e15) return Long.toString((long) d);
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        switch (type) {
            case NULL: return true;
            case NUMBER: return ((Double) value).doubleValue() == ((Double) other.value).doubleValue();
            case RECORD: {
                PropertyMap<Value> a = props();
                PropertyMap<Value> b = other.props();
                if (a.size() != b.size()) return false;
                for (String k : a.keys()) {
                    if (!b.containsKey(k) || !a.get(k).equals(b.get(k))) return false;
                }
                return true;
            }
            case FUNCTION:
            case BLOCK:
                return value == other.value;
            default:
                return Objects.equals(value, other.value);
        }
    }

    @Override
    public int hashCode() {
        switch (type) {
            case NULL: return 0;
            case NUMBER: {
                double d = (Double) value;
                return Double.hashCode(d == 0.0 ? 0.0 : d);
            }
            case RECORD: {
                int h = 0;
                PropertyMap<Value> p = props();
                for (String k : p.keys()) h += PropertyMap.fold(k).hashCode() ^ p.get(k).hashCode();
                return h;
            }
            case FUNCTION:
            case BLOCK:
                return System.identityHashCode(value);
            default:
                return value.hashCode();
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case NULL: return "$null";
            case STRING: return '"' + (String) value + '"';
            case LIST: return asList().toString();
            default: return toDisplayString();
        }
    }
}
