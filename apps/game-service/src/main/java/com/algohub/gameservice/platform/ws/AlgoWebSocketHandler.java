package com.algohub.gameservice.platform.ws;

import com.algohub.gameservice.config.AlgoServerProperties;
import com.algohub.gameservice.games.algo.application.RoomInbox;
import com.algohub.gameservice.games.algo.application.ServerInternalEvent;
import com.algohub.protocol.Envelope;
import com.algohub.protocol.codec.EnvelopeCodec;
import com.algohub.protocol.codec.MalformedMessageException;
import com.algohub.protocol.message.ClientToServerEvent;
import com.algohub.protocol.message.ServerToClientEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.concurrent.Semaphore;

/**
 * WebSocket 收发转发。
 * ----------------------------------------
 * 只做两件事：
 *   - 入站：解码后投递到房间收件队列；
 *   - 出站：由 {@link PlayerConnection} 编码后写回。
 * 接入数量受信号量限制，拿不到许可的连接收到 Error("room is full") 后被关闭。
 * 连接关闭、传输错误、解码失败都会转成 ConnectionLost。
 */
@Slf4j
@Component
public class AlgoWebSocketHandler extends TextWebSocketHandler {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT = 512 * 1024;

    private final RoomInbox inbox;
    private final ConnectionRegistry registry;
    private final EnvelopeCodec codec;
    private final Semaphore admission;

    public AlgoWebSocketHandler(RoomInbox inbox, ConnectionRegistry registry, EnvelopeCodec codec,
                                AlgoServerProperties properties) {
        this.inbox = inbox;
        this.registry = registry;
        this.codec = codec;
        this.admission = new Semaphore(properties.getRoomCapacity());
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession concurrent =
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT);
        PlayerConnection connection = new PlayerConnection(concurrent, codec,
                lost -> inbox.submit(new ServerInternalEvent.ConnectionLost(lost)));

        if (!admission.tryAcquire()) {
            log.info("拒绝连接（房间已满）: session={}", session.getId());
            connection.sendRequest(new ServerToClientEvent.ErrorMessage("room is full"));
            connection.close(CloseStatus.SERVICE_OVERLOAD);
            return;
        }
        registry.add(connection);
        log.info("连接建立: session={}, remote={}", session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        PlayerConnection connection = registry.get(session.getId()).orElse(null);
        if (connection == null) {
            return;
        }
        String payload = message.getPayload();
        if (StringUtils.isBlank(payload)) {
            return;
        }

        Envelope<ClientToServerEvent> envelope;
        try {
            envelope = codec.decodeClientEvent(payload);
        } catch (MalformedMessageException e) {
            log.warn("无法解码的消息，断开连接: session={}, payload={}, err={}",
                    session.getId(), StringUtils.abbreviate(payload, 200), e.getMessage());
            connection.markLost();
            connection.close(CloseStatus.BAD_DATA);
            return;
        }

        if (envelope.isRequest() && envelope.event() instanceof ClientToServerEvent.RequestJoin) {
            inbox.submit(new ServerInternalEvent.RequestJoin(connection, envelope));
        } else {
            inbox.submit(new ServerInternalEvent.In(connection, envelope));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("传输错误: session={}, err={}", session.getId(), exception.getMessage());
        registry.get(session.getId()).ifPresent(PlayerConnection::markLost);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        registry.remove(session.getId()).ifPresent(connection -> {
            admission.release();
            connection.markLost();
            log.info("连接关闭: session={}, status={}", session.getId(), status);
        });
    }

    /** 当前剩余的接入许可 */
    public int availablePermits() {
        return admission.availablePermits();
    }
}
