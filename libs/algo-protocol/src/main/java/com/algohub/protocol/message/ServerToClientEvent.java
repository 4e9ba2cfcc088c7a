package com.algohub.protocol.message;

import com.algohub.core.event.GameEvent;
import com.algohub.core.player.PlayerId;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 服务端发给客户端的消息。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ServerToClientEvent.RequestJoinAccepted.class, name = "RequestJoinAccepted"),
        @JsonSubTypes.Type(value = ServerToClientEvent.PlayerJoined.class, name = "PlayerJoined"),
        @JsonSubTypes.Type(value = ServerToClientEvent.PlayerDisconnected.class, name = "PlayerDisconnected"),
        @JsonSubTypes.Type(value = ServerToClientEvent.GameEventPushed.class, name = "GameEvent"),
        @JsonSubTypes.Type(value = ServerToClientEvent.ServerShutdown.class, name = "ServerShutdown"),
        @JsonSubTypes.Type(value = ServerToClientEvent.ErrorMessage.class, name = "Error")
})
public sealed interface ServerToClientEvent {

    /** 入座成功（作为 RequestJoin 的响应发出） */
    record RequestJoinAccepted(JoinInfo joinInfo) implements ServerToClientEvent {
    }

    /** 通知已入座玩家：有新玩家入座 */
    record PlayerJoined(JoinInfo joinInfo) implements ServerToClientEvent {
    }

    record PlayerDisconnected(PlayerId player) implements ServerToClientEvent {
    }

    /** 对局事件，已按接收者视角脱敏 */
    record GameEventPushed(GameEvent event) implements ServerToClientEvent {
    }

    record ServerShutdown() implements ServerToClientEvent {
    }

    record ErrorMessage(String message) implements ServerToClientEvent {
    }
}
