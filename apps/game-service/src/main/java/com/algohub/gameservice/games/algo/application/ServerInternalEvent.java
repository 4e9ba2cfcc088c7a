package com.algohub.gameservice.games.algo.application;

import com.algohub.protocol.Envelope;
import com.algohub.protocol.message.ClientToServerEvent;

/**
 * 投递给房间线程的内部事件。
 */
public sealed interface ServerInternalEvent {

    /** 某连接发来的消息（入座请求以外） */
    record In(ClientChannel channel, Envelope<ClientToServerEvent> envelope) implements ServerInternalEvent {
    }

    /** 入座请求 */
    record RequestJoin(ClientChannel channel, Envelope<ClientToServerEvent> request) implements ServerInternalEvent {
    }

    /** 连接断开（读写失败、解码失败、对端关闭） */
    record ConnectionLost(ClientChannel channel) implements ServerInternalEvent {
    }

    /** 服务关闭 */
    record Shutdown() implements ServerInternalEvent {
    }
}
