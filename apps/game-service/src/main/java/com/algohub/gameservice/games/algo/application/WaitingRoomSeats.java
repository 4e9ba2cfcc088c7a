package com.algohub.gameservice.games.algo.application;

import com.algohub.core.player.PlayerId;
import com.algohub.protocol.message.JoinInfo;
import com.algohub.protocol.message.JoinedPlayerInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * 两人座位：空 / 一人 / 满员。
 */
class WaitingRoomSeats {

    static final int ROOM_SIZE = 2;

    private final List<PlayerId> seats = new ArrayList<>(ROOM_SIZE);

    int playerNum() {
        return seats.size();
    }

    boolean isFull() {
        return seats.size() >= ROOM_SIZE;
    }

    List<PlayerId> players() {
        return List.copyOf(seats);
    }

    /**
     * 占一个座位。
     *
     * @throws IllegalStateException 已满员
     */
    JoinInfo tryClaim(PlayerId newPlayer) {
        if (isFull()) {
            throw new IllegalStateException("room is full");
        }
        JoinedPlayerInfo joined = seats.isEmpty()
                ? new JoinedPlayerInfo.First(newPlayer)
                : new JoinedPlayerInfo.Second(newPlayer, seats.get(0));
        seats.add(newPlayer);
        return new JoinInfo(joined, ROOM_SIZE);
    }

    /** 让出座位；不在座时什么也不做 */
    void remove(PlayerId player) {
        seats.remove(player);
    }
}
