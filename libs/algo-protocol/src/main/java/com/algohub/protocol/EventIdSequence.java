package com.algohub.protocol;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 发号器：第一个 ID 为 1。
 */
public class EventIdSequence {

    private final AtomicLong last = new AtomicLong();

    public EventId next() {
        return new EventId(last.incrementAndGet());
    }
}
