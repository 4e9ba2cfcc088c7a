package com.algohub.gameservice.games.algo.application;

import com.algohub.protocol.EventIdSequence;
import com.algohub.protocol.EventSender;
import com.algohub.protocol.message.ServerToClientEvent;

/**
 * 一条客户端连接的出站端。写入失败时实现方应转为断线通知，而不是抛给房间线程。
 */
public interface ClientChannel extends EventSender<ServerToClientEvent> {

    /** 连接标识（WebSocket sessionId） */
    String id();

    /** 该连接出站方向的发号器 */
    EventIdSequence ids();

    void close();
}
