package com.algohub.core.card;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 牌堆的公开视图：顶牌公开信息、剩余张数、剩余牌自底向顶的颜色序列（不含数字）。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TalonView(CardPubInfo topCard, int cardsRemaining, List<CardColor> colors) {

    public TalonView {
        colors = colors == null ? List.of() : List.copyOf(colors);
    }
}
