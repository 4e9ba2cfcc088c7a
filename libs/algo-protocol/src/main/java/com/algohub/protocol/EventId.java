package com.algohub.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 消息 ID，在单个连接的单个方向上单调递增。
 */
public record EventId(long value) implements Comparable<EventId> {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static EventId of(long value) {
        return new EventId(value);
    }

    @JsonValue
    @Override
    public long value() {
        return value;
    }

    @Override
    public int compareTo(EventId other) {
        return Long.compare(value, other.value);
    }
}
