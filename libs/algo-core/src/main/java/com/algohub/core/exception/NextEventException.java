package com.algohub.core.exception;

import lombok.Getter;

/**
 * {@code Game.nextEvent()} 的失败原因。
 */
@Getter
public class NextEventException extends IllegalStateException {

    public enum Reason {
        /** 已有事件在等待玩家响应 */
        EVENT_PROCESSING("the event is processing"),
        /** 队列已空（只在对局结束后出现） */
        NO_MORE_EVENT("there is no more events to process");

        private final String message;

        Reason(String message) {
            this.message = message;
        }
    }

    private final Reason reason;

    public NextEventException(Reason reason) {
        super(reason.message);
        this.reason = reason;
    }
}
