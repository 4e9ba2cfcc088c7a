package com.algohub.protocol.message;

/**
 * @param joinedPlayer 刚入座的玩家
 * @param roomSize     房间座位数
 */
public record JoinInfo(JoinedPlayerInfo joinedPlayer, int roomSize) {
}
