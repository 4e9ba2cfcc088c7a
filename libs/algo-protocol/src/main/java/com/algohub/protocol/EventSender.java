package com.algohub.protocol;

/**
 * 出站通道。实现方负责把消息写到对端（WebSocket、内存队列……）。
 */
@FunctionalInterface
public interface EventSender<O> {

    /**
     * 写入失败时由实现方决定抛出 IllegalStateException，或转为断线通知后丢弃。
     */
    void sendEvent(Envelope<O> envelope);
}
