package com.algohub.protocol;

import java.util.Iterator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * 入站消息收件箱：请求和响应分别按 id 存放，取用时不阻塞。
 * 同一 id 重复到达时后到的覆盖先到的。
 */
public class EventInbox<I> {

    private final NavigableMap<EventId, I> requests = new TreeMap<>();
    private final NavigableMap<EventId, I> responses = new TreeMap<>();

    public void store(Envelope<I> envelope) {
        mapFor(envelope.kind()).put(envelope.id(), envelope.event());
    }

    public Optional<I> takeRequest(EventId id) {
        return Optional.ofNullable(requests.remove(id));
    }

    public Optional<I> takeResponse(EventId id) {
        return Optional.ofNullable(responses.remove(id));
    }

    public Optional<I> peekRequest(EventId id) {
        return Optional.ofNullable(requests.get(id));
    }

    public Optional<I> peekResponse(EventId id) {
        return Optional.ofNullable(responses.get(id));
    }

    /**
     * 按 id 升序找第一个满足条件的请求（不移除）。
     */
    public Optional<Envelope<I>> findRequest(Predicate<? super I> predicate) {
        for (Map.Entry<EventId, I> e : requests.entrySet()) {
            if (predicate.test(e.getValue())) {
                return Optional.of(Envelope.request(e.getKey(), e.getValue()));
            }
        }
        return Optional.empty();
    }

    /**
     * 按 id 升序取出第一个满足条件的请求。
     */
    public Optional<Envelope<I>> takeFirstRequest(Predicate<? super I> predicate) {
        Iterator<Map.Entry<EventId, I>> it = requests.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<EventId, I> e = it.next();
            if (predicate.test(e.getValue())) {
                // remove() 之后 TreeMap 可能复用该节点存放后继，先取出内容
                Envelope<I> found = Envelope.request(e.getKey(), e.getValue());
                it.remove();
                return Optional.of(found);
            }
        }
        return Optional.empty();
    }

    public int pendingRequests() {
        return requests.size();
    }

    public int pendingResponses() {
        return responses.size();
    }

    private NavigableMap<EventId, I> mapFor(EventKind kind) {
        return kind == EventKind.REQUEST ? requests : responses;
    }
}
