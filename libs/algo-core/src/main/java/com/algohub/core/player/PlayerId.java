package com.algohub.core.player;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 玩家标识，线上以裸数字传输。
 */
public record PlayerId(int value) implements Comparable<PlayerId> {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PlayerId of(int value) {
        return new PlayerId(value);
    }

    @JsonValue
    public int value() {
        return value;
    }

    @Override
    public int compareTo(PlayerId other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "PlayerId(" + value + ")";
    }
}
