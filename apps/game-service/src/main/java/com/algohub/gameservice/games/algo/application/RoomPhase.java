package com.algohub.gameservice.games.algo.application;

public enum RoomPhase {

    WAITING,   // 等待玩家入座
    PLAYING,   // 对局中
    STOPPED    // 服务已关闭
}
