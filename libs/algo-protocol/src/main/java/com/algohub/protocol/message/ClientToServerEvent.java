package com.algohub.protocol.message;

import com.algohub.core.event.GameEvent;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 客户端发给服务端的消息。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ClientToServerEvent.RequestJoin.class, name = "RequestJoin"),
        @JsonSubTypes.Type(value = ClientToServerEvent.GameEventResponse.class, name = "GameEventResponse")
})
public sealed interface ClientToServerEvent {

    /** 申请入座 */
    record RequestJoin() implements ClientToServerEvent {
    }

    /** 对服务端推送的 GameEvent 的响应（决策或 RespOk） */
    record GameEventResponse(GameEvent event) implements ClientToServerEvent {
    }
}
