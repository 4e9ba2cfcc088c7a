package com.algohub.core.exception;

import com.algohub.core.event.GameEvent;
import com.algohub.core.event.GameEventKind;
import com.algohub.core.player.PlayerId;
import lombok.Getter;

/**
 * {@code Game.processEvent()} 的失败。
 * <p>
 * INVALID_RESPONSE 时携带出错玩家、期望的事件类型和实际收到的响应；
 * 抛出时引擎状态未被修改，暂存事件仍然暂存。
 */
@Getter
public class ProcessEventException extends IllegalStateException {

    public enum Reason {
        /** 仍有玩家未响应 */
        NOT_READY,
        /** 响应类型或取值不合法 */
        INVALID_RESPONSE
    }

    private final Reason reason;
    private final PlayerId player;
    private final GameEventKind expected;
    private final GameEvent actual;

    private ProcessEventException(Reason reason, String message,
                                  PlayerId player, GameEventKind expected, GameEvent actual) {
        super(message);
        this.reason = reason;
        this.player = player;
        this.expected = expected;
        this.actual = actual;
    }

    public static ProcessEventException notReady() {
        return new ProcessEventException(Reason.NOT_READY,
                "the event is not ready to be processed", null, null, null);
    }

    public static ProcessEventException invalidResponse(PlayerId player, GameEventKind expected,
                                                        GameEvent actual, String detail) {
        String message = String.format("invalid response from %s: expected %s, got %s (%s)",
                player, expected, actual, detail);
        return new ProcessEventException(Reason.INVALID_RESPONSE, message, player, expected, actual);
    }
}
