package com.algohub.protocol;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * 单个连接的消息处理器：出站通道 + 发号器 + 入站收件箱。
 *
 * @param <I> 入站载荷类型
 * @param <O> 出站载荷类型
 */
@Slf4j
public class EventHandler<I, O> {

    private final EventSender<O> sender;
    private final EventIdSequence ids;
    private final EventInbox<I> inbox = new EventInbox<>();

    public EventHandler(EventSender<O> sender) {
        this(sender, new EventIdSequence());
    }

    /**
     * @param ids 出站发号器；同一连接上的多个处理器共用时传入同一个
     */
    public EventHandler(EventSender<O> sender, EventIdSequence ids) {
        this.sender = sender;
        this.ids = ids;
    }

    /** 以新 id 发送一个请求，返回分配的 id */
    public EventId send(O event) {
        EventId id = ids.next();
        sender.sendEvent(Envelope.request(id, event));
        return id;
    }

    /** 响应对端的某个请求 */
    public void reply(Envelope<?> request, O event) {
        sender.sendEvent(Envelope.responseTo(request, event));
    }

    /** 收下一条入站消息 */
    public void receive(Envelope<I> envelope) {
        log.debug("received {}", envelope);
        inbox.store(envelope);
    }

    public Optional<I> takeRequest(EventId id) {
        return inbox.takeRequest(id);
    }

    public Optional<I> takeResponse(EventId id) {
        return inbox.takeResponse(id);
    }

    public Optional<I> peekRequest(EventId id) {
        return inbox.peekRequest(id);
    }

    public Optional<I> peekResponse(EventId id) {
        return inbox.peekResponse(id);
    }

    public Optional<Envelope<I>> findRequest(Predicate<? super I> predicate) {
        return inbox.findRequest(predicate);
    }

    public Optional<Envelope<I>> takeFirstRequest(Predicate<? super I> predicate) {
        return inbox.takeFirstRequest(predicate);
    }
}
