package com.algohub.gameservice.games.algo.application;

/** 对局实例的结束方式 */
public enum MatchOutcome {
    /** 正常结束（GameEnded 已处理） */
    FINISHED,
    /** 非法响应次数超限，对局被终止 */
    ABORTED,
    /** 服务关闭 */
    SHUTDOWN
}
