package com.algohub.core.card;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Locale;
import java.util.Objects;

/**
 * 面向某个观察者的卡牌视图。
 * <ul>
 *   <li>pubInfo：总是存在</li>
 *   <li>privInfo：只有牌已翻开或观察者就是持有者时才存在，否则为 null</li>
 * </ul>
 * 文本格式：{@code COLOR-NUMBER[-U|-D]}，例如 {@code BLACK-7-U}、{@code WHITE-?}。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CardView(CardPubInfo pubInfo, CardPrivInfo privInfo) {

    public CardView {
        Objects.requireNonNull(pubInfo, "pubInfo");
    }

    /** 带数字的完整视图 */
    public static CardView full(Card card) {
        return new CardView(card.pubInfo(), card.privInfo());
    }

    /** 隐藏数字的视图 */
    public static CardView hidden(Card card) {
        return new CardView(card.pubInfo(), null);
    }

    /**
     * 按观察者身份构造视图。
     *
     * @param card          权威卡牌
     * @param viewerIsOwner 观察者是否为持有者
     */
    public static CardView of(Card card, boolean viewerIsOwner) {
        return viewerIsOwner ? full(card) : card.publicView();
    }

    /**
     * 直接用属性构造。
     * 注意：可能构造出“已翻开却没有数字”的非法视图，仅用于解析/测试。
     */
    public static CardView fromProps(CardColor color, Integer number, boolean revealed) {
        return new CardView(new CardPubInfo(color, revealed),
                number == null ? null : new CardPrivInfo(number));
    }

    @JsonIgnore
    public boolean hasNumber() {
        return privInfo != null;
    }

    /** 对其他玩家公开的视图：未翻开则去掉数字 */
    public CardView publicView() {
        if (pubInfo.revealed() || privInfo == null) {
            return this;
        }
        return new CardView(pubInfo, null);
    }

    public String format() {
        return pubInfo.color() + "-" + (privInfo == null ? "?" : String.valueOf(privInfo.number()));
    }

    /**
     * 解析文本格式。缺省翻开标记时视为已翻开；"?" 表示未翻开且数字隐藏。
     *
     * @throws IllegalArgumentException 格式错误
     */
    public static CardView parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("CardColor is missing");
        }
        String[] parts = text.split("-");
        CardColor color = CardColor.parse(parts[0]);
        if (parts.length < 2 || parts[1].isBlank()) {
            throw new IllegalArgumentException("CardNumber is missing");
        }
        String num = parts[1].trim();
        if ("?".equals(num)) {
            return fromProps(color, null, false);
        }
        int number;
        try {
            number = Integer.parseInt(num);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid CardNumber: " + num, e);
        }
        boolean revealed = true;
        if (parts.length > 2) {
            String flag = parts[2].trim().toUpperCase(Locale.ROOT);
            revealed = !"D".equals(flag);
        }
        return fromProps(color, number, revealed);
    }
}
