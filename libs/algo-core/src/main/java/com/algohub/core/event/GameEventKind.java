package com.algohub.core.event;

import lombok.Getter;

/**
 * 事件类型（不带载荷），用于 switch 分派和错误信息。
 * decision：该事件本身是玩家的决策；decisionRequired：广播后需要回合玩家给出决策。
 */
@Getter
public enum GameEventKind {
    BOARD_CHANGED(false, false),
    GAME_STARTED(false, false),
    TURN_ORDER_DETERMINED(false, false),
    CARD_DISTRIBUTED(false, false),
    TURN_STARTED(false, false),
    TURN_PLAYER_DREW_CARD(false, false),
    NO_CARDS_LEFT(false, false),
    ATTACK_TARGET_SELECTION_REQUIRED(false, true),
    ATTACK_TARGET_SELECTED(true, false),
    NUMBER_GUESS_REQUIRED(false, true),
    NUMBER_GUESSED(true, false),
    ATTACK_SUCCEEDED(false, false),
    ATTACK_FAILED(false, false),
    ATTACKED_PLAYER_LOST(false, false),
    GAME_ENDED(false, false),
    ATTACK_OR_STAY_DECISION_REQUIRED(false, true),
    ATTACK_OR_STAY_DECIDED(true, false),
    TURN_ENDED(false, false),
    RESP_OK(false, false);

    private final boolean decision;
    private final boolean decisionRequired;

    GameEventKind(boolean decision, boolean decisionRequired) {
        this.decision = decision;
        this.decisionRequired = decisionRequired;
    }
}
