package com.algohub.core.card;

import java.util.Comparator;
import java.util.Objects;

/**
 * 一张牌的权威副本（服务端持有，公开/私有信息都在）。
 * <p>
 * 身份 = (number, color)，数字在整个生命周期内不可变；
 * 翻牌通过 {@link #reveal()} 返回新实例，revealed 只会从 false 变为 true。
 * 排序规则：先按数字，数字相同再按颜色。
 */
public record Card(CardPubInfo pubInfo, CardPrivInfo privInfo) implements Comparable<Card> {

    private static final Comparator<Card> ORDER = Comparator
            .comparingInt(Card::number)
            .thenComparing(Card::color);

    public Card {
        Objects.requireNonNull(pubInfo, "pubInfo");
        Objects.requireNonNull(privInfo, "privInfo");
    }

    public static Card of(int number, CardColor color) {
        return new Card(CardPubInfo.faceDown(color), new CardPrivInfo(number));
    }

    public int number() { return privInfo.number(); }

    public CardColor color() { return pubInfo.color(); }

    public boolean revealed() { return pubInfo.revealed(); }

    /** 翻开这张牌 */
    public Card reveal() {
        return revealed() ? this : new Card(pubInfo.reveal(), privInfo);
    }

    /** 所有玩家都能看到的视图：已翻开则带数字，否则隐藏数字 */
    public CardView publicView() {
        return revealed() ? CardView.full(this) : CardView.hidden(this);
    }

    /** 判断身份是否相同（忽略翻开状态） */
    public boolean sameIdentity(Card other) {
        return other != null && number() == other.number() && color() == other.color();
    }

    @Override
    public int compareTo(Card other) {
        return ORDER.compare(this, other);
    }
}
