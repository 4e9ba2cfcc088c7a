package com.algohub.core.engine;

import com.algohub.core.player.PlayerId;
import com.algohub.core.player.TurnPlayer;

/**
 * 回合上下文。一个回合由一次或多次进攻组成。
 */
class TurnContext {

    private final TurnPlayer turnPlayer;
    private final AttackContext attack = new AttackContext();

    TurnContext(TurnPlayer turnPlayer) {
        this.turnPlayer = turnPlayer;
    }

    TurnPlayer turnPlayer() {
        return turnPlayer;
    }

    AttackContext attack() {
        return attack;
    }

    PlayerId current() {
        return turnPlayer.current()
                .orElseThrow(() -> new IllegalStateException("turn order is empty"));
    }

    /** 回合结束：轮转行动顺序并清空进攻上下文 */
    void endTurn() {
        turnPlayer.advance();
        attack.clear();
    }
}
