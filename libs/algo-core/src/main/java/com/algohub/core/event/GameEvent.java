package com.algohub.core.event;

import com.algohub.core.card.TalonView;
import com.algohub.core.player.PlayerId;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * 对局推进过程中的所有事件（封闭集合）。
 * <p>
 * 引擎每次只暂存其中一个，广播给所有玩家并收齐响应后才处理下一个。
 * 决策类事件（{@link #isDecision()}）由回合玩家作为响应发回；
 * 其余玩家、以及不需要决策的事件，一律以 {@link RespOk} 应答。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = GameEvent.BoardChanged.class, name = "BoardChanged"),
        @JsonSubTypes.Type(value = GameEvent.GameStarted.class, name = "GameStarted"),
        @JsonSubTypes.Type(value = GameEvent.TurnOrderDetermined.class, name = "TurnOrderDetermined"),
        @JsonSubTypes.Type(value = GameEvent.CardDistributed.class, name = "CardDistributed"),
        @JsonSubTypes.Type(value = GameEvent.TurnStarted.class, name = "TurnStarted"),
        @JsonSubTypes.Type(value = GameEvent.TurnPlayerDrewCard.class, name = "TurnPlayerDrewCard"),
        @JsonSubTypes.Type(value = GameEvent.NoCardsLeft.class, name = "NoCardsLeft"),
        @JsonSubTypes.Type(value = GameEvent.AttackTargetSelectionRequired.class, name = "AttackTargetSelectionRequired"),
        @JsonSubTypes.Type(value = GameEvent.AttackTargetSelected.class, name = "AttackTargetSelected"),
        @JsonSubTypes.Type(value = GameEvent.NumberGuessRequired.class, name = "NumberGuessRequired"),
        @JsonSubTypes.Type(value = GameEvent.NumberGuessed.class, name = "NumberGuessed"),
        @JsonSubTypes.Type(value = GameEvent.AttackSucceeded.class, name = "AttackSucceeded"),
        @JsonSubTypes.Type(value = GameEvent.AttackFailed.class, name = "AttackFailed"),
        @JsonSubTypes.Type(value = GameEvent.AttackedPlayerLost.class, name = "AttackedPlayerLost"),
        @JsonSubTypes.Type(value = GameEvent.GameEnded.class, name = "GameEnded"),
        @JsonSubTypes.Type(value = GameEvent.AttackOrStayDecisionRequired.class, name = "AttackOrStayDecisionRequired"),
        @JsonSubTypes.Type(value = GameEvent.AttackOrStayDecided.class, name = "AttackOrStayDecided"),
        @JsonSubTypes.Type(value = GameEvent.TurnEnded.class, name = "TurnEnded"),
        @JsonSubTypes.Type(value = GameEvent.RespOk.class, name = "RespOk")
})
public sealed interface GameEvent {

    GameEventKind kind();

    /** 该事件本身是否为玩家决策 */
    @JsonIgnore
    default boolean isDecision() {
        return kind().isDecision();
    }

    /** 广播后是否需要回合玩家给出决策 */
    @JsonIgnore
    default boolean isDecisionRequired() {
        return kind().isDecisionRequired();
    }

    @JsonIgnore
    default ResponseKind expectedResponse() {
        return isDecisionRequired() ? ResponseKind.DECISION : ResponseKind.ACKNOWLEDGEMENT;
    }

    /**
     * 返回去掉观察者不应看到信息后的副本。只有盘面变化需要脱敏。
     */
    default GameEvent view(PlayerId viewer) {
        return this;
    }

    /** 盘面变化 */
    record BoardChanged(BoardChange change) implements GameEvent {
        @Override
        public GameEventKind kind() { return GameEventKind.BOARD_CHANGED; }

        @Override
        public GameEvent view(PlayerId viewer) {
            return new BoardChanged(change.view(viewer));
        }
    }

    /** 对局开始，附带牌堆公开视图 */
    record GameStarted(TalonView talon) implements GameEvent {
        @Override
        public GameEventKind kind() { return GameEventKind.GAME_STARTED; }
    }

    /** 行动顺序已确定 */
    record TurnOrderDetermined(List<PlayerId> order) implements GameEvent {
        public TurnOrderDetermined {
            order = List.copyOf(order);
        }

        @Override
        public GameEventKind kind() { return GameEventKind.TURN_ORDER_DETERMINED; }
    }

    /** 给某玩家发一张牌 */
    record CardDistributed(PlayerId player) implements GameEvent {
        @Override
        public GameEventKind kind() { return GameEventKind.CARD_DISTRIBUTED; }
    }

    /** 回合交给该玩家 */
    record TurnStarted(PlayerId player) implements GameEvent {
        @Override
        public GameEventKind kind() { return GameEventKind.TURN_STARTED; }
    }

    /** 回合玩家抽牌 */
    record TurnPlayerDrewCard() implements GameEvent {
        @Override
        public GameEventKind kind() { return GameEventKind.TURN_PLAYER_DREW_CARD; }
    }

    /** 牌堆已空，平局 */
    record NoCardsLeft() implements GameEvent {
        @Override
        public GameEventKind kind() { return GameEventKind.NO_CARDS_LEFT; }
    }

    /** 回合玩家需要选择要攻击的牌 */
    record AttackTargetSelectionRequired(PlayerId targetPlayer) implements GameEvent {
        @Override
        public GameEventKind kind() { return GameEventKind.ATTACK_TARGET_SELECTION_REQUIRED; }
    }

    /** 回合玩家选择了目标牌（决策） */
    record AttackTargetSelected(int targetIdx) implements GameEvent {
        @Override
        public GameEventKind kind() { return GameEventKind.ATTACK_TARGET_SELECTED; }
    }

    /** 回合玩家需要猜数字 */
    record NumberGuessRequired() implements GameEvent {
        @Override
        public GameEventKind kind() { return GameEventKind.NUMBER_GUESS_REQUIRED; }
    }

    /** 回合玩家猜了数字（决策） */
    record NumberGuessed(int number) implements GameEvent {
        @Override
        public GameEventKind kind() { return GameEventKind.NUMBER_GUESSED; }
    }

    /** 猜中，对手翻开目标牌 */
    record AttackSucceeded() implements GameEvent {
        @Override
        public GameEventKind kind() { return GameEventKind.ATTACK_SUCCEEDED; }
    }

    /** 猜错，回合玩家翻开抽到的牌放进自己手牌区 */
    record AttackFailed() implements GameEvent {
        @Override
        public GameEventKind kind() { return GameEventKind.ATTACK_FAILED; }
    }

    /** 被攻击玩家的手牌已全部翻开 */
    record AttackedPlayerLost(PlayerId player) implements GameEvent {
        @Override
        public GameEventKind kind() { return GameEventKind.ATTACKED_PLAYER_LOST; }
    }

    /** 对局结束 */
    record GameEnded() implements GameEvent {
        @Override
        public GameEventKind kind() { return GameEventKind.GAME_ENDED; }
    }

    /** 回合玩家需要决定继续攻击还是停手 */
    record AttackOrStayDecisionRequired() implements GameEvent {
        @Override
        public GameEventKind kind() { return GameEventKind.ATTACK_OR_STAY_DECISION_REQUIRED; }
    }

    /** 回合玩家决定继续攻击（true）或停手（false）（决策） */
    record AttackOrStayDecided(boolean attack) implements GameEvent {
        @Override
        public GameEventKind kind() { return GameEventKind.ATTACK_OR_STAY_DECIDED; }
    }

    /** 回合结束 */
    record TurnEnded() implements GameEvent {
        @Override
        public GameEventKind kind() { return GameEventKind.TURN_ENDED; }
    }

    /** 通用确认应答 */
    record RespOk() implements GameEvent {
        @Override
        public GameEventKind kind() { return GameEventKind.RESP_OK; }
    }
}
