package com.algohub.core.player;

import com.algohub.core.card.CardView;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 某个玩家的手牌区视图（可能已按观察者脱敏）。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlayerView(PlayerId id, List<CardView> field, CardView attacker) {

    public PlayerView {
        field = List.copyOf(field);
    }
}
