package com.algohub.core.engine;

import com.algohub.core.player.PlayerId;

import java.util.Optional;

/**
 * 一次进攻的上下文，只能按 目标玩家 → 目标下标 → 猜测 的顺序填充。
 */
class AttackContext {

    private PlayerId targetPlayer;
    private Integer targetCardIdx;
    private Integer guess;

    Optional<PlayerId> targetPlayer() {
        return Optional.ofNullable(targetPlayer);
    }

    Optional<Integer> targetCardIdx() {
        return Optional.ofNullable(targetCardIdx);
    }

    Optional<Integer> guess() {
        return Optional.ofNullable(guess);
    }

    void selectTargetPlayer(PlayerId player) {
        this.targetPlayer = player;
        this.targetCardIdx = null;
        this.guess = null;
    }

    void selectTargetCard(int idx) {
        if (targetPlayer == null) {
            throw new IllegalStateException("target player is not selected");
        }
        this.targetCardIdx = idx;
        this.guess = null;
    }

    void guess(int number) {
        if (targetCardIdx == null) {
            throw new IllegalStateException("target card is not selected");
        }
        this.guess = number;
    }

    /** 一次进攻结算后清空下标和猜测，目标玩家保留给下一次进攻 */
    void clearSelection() {
        targetCardIdx = null;
        guess = null;
    }

    void clear() {
        targetPlayer = null;
        clearSelection();
    }
}
