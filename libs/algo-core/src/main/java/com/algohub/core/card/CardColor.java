package com.algohub.core.card;

import java.util.Locale;

/**
 * 卡牌颜色。
 * 同一数字的黑白两张牌按颜色区分先后：BLACK 排在 WHITE 之前。
 */
public enum CardColor {
    BLACK,
    WHITE;

    /**
     * 从文本解析颜色，忽略大小写与首尾空白（"black" / " White "）。
     *
     * @param text 颜色文本
     * @return 对应的颜色
     * @throws IllegalArgumentException 未知颜色
     */
    public static CardColor parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("unknown CardColor: null");
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        for (CardColor color : values()) {
            if (color.name().equals(normalized)) {
                return color;
            }
        }
        throw new IllegalArgumentException("unknown CardColor: " + text.trim());
    }
}
