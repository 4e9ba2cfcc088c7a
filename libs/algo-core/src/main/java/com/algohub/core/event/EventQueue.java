package com.algohub.core.event;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * 两级 FIFO 事件队列。
 * sub 队列放盘面变化通知，总是先于 main 队列出队；同一级内部保持先进先出。
 */
public class EventQueue<T> {

    private final Deque<T> mainQueue = new ArrayDeque<>();
    private final Deque<T> subQueue = new ArrayDeque<>();

    /** 取下一个待暂存的事件，没有则 empty */
    public Optional<T> popNext() {
        T ev = subQueue.pollFirst();
        if (ev != null) {
            return Optional.of(ev);
        }
        return Optional.ofNullable(mainQueue.pollFirst());
    }

    public void pushMain(T event) {
        mainQueue.addLast(event);
    }

    public void pushSub(T event) {
        subQueue.addLast(event);
    }

    public boolean isEmpty() {
        return mainQueue.isEmpty() && subQueue.isEmpty();
    }

    public int size() {
        return mainQueue.size() + subQueue.size();
    }
}
