package com.algohub.protocol.message;

import com.algohub.core.player.PlayerId;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Optional;

/**
 * 入座信息：第一个入座的只有自己的 ID；第二个入座的同时带上正在等待的玩家。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = JoinedPlayerInfo.First.class, name = "First"),
        @JsonSubTypes.Type(value = JoinedPlayerInfo.Second.class, name = "Second")
})
public sealed interface JoinedPlayerInfo {

    PlayerId assignedPlayerId();

    Optional<PlayerId> waitingPlayerId();

    /** 入座顺位，从 1 开始 */
    int joinPosition();

    record First(PlayerId player) implements JoinedPlayerInfo {
        @Override
        public PlayerId assignedPlayerId() { return player; }

        @Override
        public Optional<PlayerId> waitingPlayerId() { return Optional.empty(); }

        @Override
        public int joinPosition() { return 1; }
    }

    record Second(PlayerId justJoined, PlayerId waitingPlayer) implements JoinedPlayerInfo {
        @Override
        public PlayerId assignedPlayerId() { return justJoined; }

        @Override
        public Optional<PlayerId> waitingPlayerId() { return Optional.of(waitingPlayer); }

        @Override
        public int joinPosition() { return 2; }
    }
}
