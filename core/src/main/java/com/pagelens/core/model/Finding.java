package com.pagelens.core.model;

import java.util.Objects;

/** 진단 한 줄: 수준 + 사람이 읽는 메시지 */
public final class Finding {
    private final Status level;
    private final String message;

    private Finding(Status level, String message) {
        this.level = Objects.requireNonNull(level, "level");
        this.message = Objects.requireNonNull(message, "message");
    }

    public static Finding pass(String message) { return new Finding(Status.PASS, message); }
    public static Finding warn(String message) { return new Finding(Status.WARN, message); }
    public static Finding fail(String message) { return new Finding(Status.FAIL, message); }
    public static Finding info(String message) { return new Finding(Status.INFO, message); }

    public Status getLevel() { return level; }
    public String getMessage() { return message; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Finding f)) return false;
        return level == f.level && message.equals(f.message);
    }

    @Override
    public int hashCode() { return Objects.hash(level, message); }

    @Override
    public String toString() { return level + ": " + message; }
}
