package com.algohub.gameservice.games.algo.application;

import com.algohub.core.event.GameEvent;
import com.algohub.core.player.PlayerId;
import com.algohub.protocol.Envelope;
import com.algohub.protocol.EventHandler;
import com.algohub.protocol.EventId;
import com.algohub.protocol.EventKind;
import com.algohub.protocol.message.ClientToServerEvent;
import com.algohub.protocol.message.JoinInfo;
import com.algohub.protocol.message.ServerToClientEvent;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * 单个已入座玩家的收发处理。
 * <p>
 * 记录当前等待该玩家响应的 GameEvent 的 id，过期或不匹配的响应一律丢弃并记日志。
 */
@Slf4j
public class PlayerHandler {

    @Getter
    private final PlayerId playerId;
    @Getter
    private final ClientChannel channel;
    private final EventHandler<ClientToServerEvent, ServerToClientEvent> events;

    /** 正在等待响应的 GameEvent 请求 id */
    private EventId awaitingId;
    /** 最近一次推送的 GameEvent，用于重新询问 */
    private GameEvent lastGameEvent;
    @Getter
    private boolean connected = true;

    public PlayerHandler(PlayerId playerId, ClientChannel channel) {
        this.playerId = playerId;
        this.channel = channel;
        this.events = new EventHandler<>(channel, channel.ids());
    }

    /** 以新请求发送一条消息 */
    public EventId sendMessage(ServerToClientEvent event) {
        return events.send(event);
    }

    /** 回应入座请求 */
    public void replyJoinAccepted(Envelope<ClientToServerEvent> request, JoinInfo joinInfo) {
        events.reply(request, new ServerToClientEvent.RequestJoinAccepted(joinInfo));
    }

    /** 推送对局事件并开始等待该玩家的响应 */
    public EventId sendGameEvent(GameEvent event) {
        lastGameEvent = event;
        awaitingId = events.send(new ServerToClientEvent.GameEventPushed(event));
        return awaitingId;
    }

    /**
     * 以新 id 重发最近一次的对局事件。
     *
     * @throws IllegalStateException 还没推送过对局事件
     */
    public EventId resendGameEvent() {
        if (lastGameEvent == null) {
            throw new IllegalStateException("no game event has been sent to " + playerId);
        }
        return sendGameEvent(lastGameEvent);
    }

    public void notifyPlayerDisconnected(PlayerId player) {
        sendMessage(new ServerToClientEvent.PlayerDisconnected(player));
    }

    public void sendError(String message) {
        sendMessage(new ServerToClientEvent.ErrorMessage(message));
    }

    public boolean isAwaitingResponse() {
        return awaitingId != null;
    }

    public void markDisconnected() {
        connected = false;
    }

    /**
     * 检查入站消息是否为当前等待中的 GameEvent 响应。
     *
     * @return 响应里携带的 GameEvent；不是期望的响应时返回 empty
     */
    public Optional<GameEvent> checkForGameEventResponse(Envelope<ClientToServerEvent> envelope) {
        if (envelope.kind() != EventKind.RESPONSE) {
            log.warn("玩家 {} 发来了非响应消息，已忽略: {}", playerId, envelope);
            return Optional.empty();
        }
        events.receive(envelope);
        if (awaitingId == null || !awaitingId.equals(envelope.id())) {
            events.takeResponse(envelope.id());
            log.warn("玩家 {} 的响应 id 过期或不匹配: expected={}, actual={}", playerId, awaitingId, envelope.id());
            return Optional.empty();
        }
        ClientToServerEvent resp = events.takeResponse(awaitingId).orElseThrow();
        if (!(resp instanceof ClientToServerEvent.GameEventResponse r)) {
            log.warn("玩家 {} 的响应不是 GameEventResponse: {}", playerId, resp);
            return Optional.empty();
        }
        awaitingId = null;
        return Optional.of(r.event());
    }

    public void close() {
        channel.close();
    }
}
