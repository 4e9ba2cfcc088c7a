package com.algohub.core.card;

/**
 * 卡牌的私有信息：数字。只有持有者或牌已翻开时才可见。
 */
public record CardPrivInfo(int number) {
}
