package com.algohub.core.exception;

import com.algohub.core.player.PlayerId;
import lombok.Getter;

/**
 * 引用了不在本局中的玩家。
 */
@Getter
public class UnknownPlayerException extends IllegalArgumentException {

    private final PlayerId playerId;

    public UnknownPlayerException(PlayerId playerId) {
        super("unknown PlayerId: " + playerId);
        this.playerId = playerId;
    }
}
