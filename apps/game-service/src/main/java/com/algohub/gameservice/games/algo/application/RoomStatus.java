package com.algohub.gameservice.games.algo.application;

import com.algohub.core.player.PlayerId;

import java.util.List;

/**
 * 房间状态快照（只读，供 HTTP 查询）。
 */
public record RoomStatus(RoomPhase phase, List<PlayerId> players, int roomSize, int matchesPlayed) {

    public RoomStatus {
        players = List.copyOf(players);
    }
}
