package com.algohub.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 线上传输的消息外壳
 * - 最少字段：kind / id / event
 * - 请求由发送方分配 id；响应沿用被响应请求的 id，kind 换成 RESPONSE
 *
 * 用法示例：
 *   Envelope<ServerToClientEvent>  req  = Envelope.request(ids.next(), event);
 *   Envelope<ClientToServerEvent>  resp = Envelope.responseTo(req, answer);
 */
public final class Envelope<E> {

    private final EventKind kind;
    private final EventId id;
    private final E event;

    @JsonCreator
    public Envelope(@JsonProperty("kind") EventKind kind,
                    @JsonProperty("id") EventId id,
                    @JsonProperty("event") E event) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.id = Objects.requireNonNull(id, "id");
        this.event = Objects.requireNonNull(event, "event");
    }

    public static <E> Envelope<E> request(EventId id, E event) {
        return new Envelope<>(EventKind.REQUEST, id, event);
    }

    /** 对 request 的响应：沿用其 id */
    public static <E> Envelope<E> responseTo(Envelope<?> request, E event) {
        return new Envelope<>(EventKind.RESPONSE, request.id, event);
    }

    /** 保留头部，替换载荷 */
    public <U> Envelope<U> withEvent(U newEvent) {
        return new Envelope<>(kind, id, newEvent);
    }

    // getters（不可变对象，无 setters）
    @JsonProperty("kind")
    public EventKind kind() { return kind; }

    @JsonProperty("id")
    public EventId id() { return id; }

    @JsonProperty("event")
    public E event() { return event; }

    @JsonIgnore
    public boolean isRequest() { return kind == EventKind.REQUEST; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Envelope<?> other)) return false;
        return kind == other.kind && id.equals(other.id) && event.equals(other.event);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, id, event);
    }

    @Override
    public String toString() {
        return "Envelope{kind=" + kind + ", id=" + id.value() + ", event=" + event + '}';
    }
}
