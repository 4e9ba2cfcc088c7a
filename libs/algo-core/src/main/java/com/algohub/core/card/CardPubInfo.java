package com.algohub.core.card;

/**
 * 卡牌的公开信息：颜色 + 是否已翻开。任何玩家都能看到。
 */
public record CardPubInfo(CardColor color, boolean revealed) {

    /** 新牌默认背面朝上 */
    public static CardPubInfo faceDown(CardColor color) {
        return new CardPubInfo(color, false);
    }

    /** 翻开后的公开信息（revealed 只能 false -> true） */
    public CardPubInfo reveal() {
        return revealed ? this : new CardPubInfo(color, true);
    }
}
