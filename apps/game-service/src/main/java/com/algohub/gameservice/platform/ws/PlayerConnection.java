package com.algohub.gameservice.platform.ws;

import com.algohub.gameservice.games.algo.application.ClientChannel;
import com.algohub.protocol.Envelope;
import com.algohub.protocol.EventIdSequence;
import com.algohub.protocol.codec.EnvelopeCodec;
import com.algohub.protocol.message.ServerToClientEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 一条 WebSocket 连接的出站端。
 * 写入失败或连接关闭后只通知一次 onLost，之后的发送直接丢弃。
 */
@Slf4j
public class PlayerConnection implements ClientChannel {

    private final WebSocketSession session;
    private final EnvelopeCodec codec;
    private final Consumer<PlayerConnection> onLost;
    private final EventIdSequence ids = new EventIdSequence();
    private final AtomicBoolean lost = new AtomicBoolean(false);

    /**
     * @param session 需要支持多线程发送（见 ConcurrentWebSocketSessionDecorator）
     */
    public PlayerConnection(WebSocketSession session, EnvelopeCodec codec, Consumer<PlayerConnection> onLost) {
        this.session = session;
        this.codec = codec;
        this.onLost = onLost;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public EventIdSequence ids() {
        return ids;
    }

    @Override
    public void sendEvent(Envelope<ServerToClientEvent> envelope) {
        if (lost.get() || !session.isOpen()) {
            log.debug("drop message to closed connection {}: {}", id(), envelope);
            return;
        }
        try {
            session.sendMessage(new TextMessage(codec.encodeServerEvent(envelope)));
        } catch (IOException | IllegalStateException e) {
            log.warn("发送消息失败，按断线处理: connection={}, err={}", id(), e.getMessage());
            markLost();
            close(CloseStatus.SERVER_ERROR);
        }
    }

    /** 以新 id 发送一个请求 */
    public void sendRequest(ServerToClientEvent event) {
        sendEvent(Envelope.request(ids.next(), event));
    }

    /** 标记为断线，首次调用时通知 onLost */
    public void markLost() {
        if (lost.compareAndSet(false, true)) {
            onLost.accept(this);
        }
    }

    public boolean isLost() {
        return lost.get();
    }

    @Override
    public void close() {
        close(CloseStatus.NORMAL);
    }

    public void close(CloseStatus status) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException e) {
            log.warn("关闭连接失败: connection={}, err={}", id(), e.getMessage());
        }
    }
}
