package com.algohub.core.event;

import com.algohub.core.card.CardView;
import com.algohub.core.player.PlayerId;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 盘面变化通知。引擎里携带完整 CardView，发给每个玩家前再按观察者脱敏。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BoardChange.CardMoved.class, name = "CardMoved"),
        @JsonSubTypes.Type(value = BoardChange.CardRevealed.class, name = "CardRevealed")
})
public sealed interface BoardChange {

    PlayerId player();

    CardView card();

    /**
     * 返回去掉观察者不应看到信息后的副本。
     */
    BoardChange view(PlayerId viewer);

    /** 一张牌发生了移动；非持有者看不到未翻开牌的数字 */
    record CardMoved(PlayerId player, CardMovement movement, CardView card) implements BoardChange {
        @Override
        public BoardChange view(PlayerId viewer) {
            if (player.equals(viewer)) {
                return this;
            }
            return new CardMoved(player, movement, card.publicView());
        }
    }

    /** 一张牌被翻开；翻开的牌对所有人可见 */
    record CardRevealed(PlayerId player, CardLocation location, CardView card) implements BoardChange {
        @Override
        public BoardChange view(PlayerId viewer) {
            return this;
        }
    }
}
