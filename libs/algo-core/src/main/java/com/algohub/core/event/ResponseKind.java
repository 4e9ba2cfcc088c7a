package com.algohub.core.event;

/**
 * 对一个 {@link GameEvent} 的响应种类。
 */
public enum ResponseKind {
    /** 只需告知已收到（回复 RespOk） */
    ACKNOWLEDGEMENT,
    /** 需要回合玩家给出决策 */
    DECISION
}
