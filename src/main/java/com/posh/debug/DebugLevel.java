package com.posh.debug;

public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public boolean atLeast(DebugLevel other) {
        return ordinal() >= other.ordinal();
    }

    /** Case-insensitive lookup; unknown names map to DEBUG. */
    public static DebugLevel parse(String name) {
        if (name == null) return DEBUG;
        for (DebugLevel l : values()) {
            if (l.name().equalsIgnoreCase(name.trim())) return l;
        }
        return DEBUG;
    }
}
