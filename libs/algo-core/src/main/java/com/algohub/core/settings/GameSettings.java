package com.algohub.core.settings;

import com.algohub.core.card.Card;
import com.algohub.core.card.CardColor;
import com.algohub.core.exception.GameSetupException;

import java.util.ArrayList;
import java.util.List;

/**
 * 对局规则配置（创建时确定，运行期不可变）。
 *
 * @param cardColors     参与的颜色（至少 2 种）
 * @param maxCardNumber  最大数字，牌面取值 0..=maxCardNumber（{@link #MAX_CARD_NUM_DEFAULT} 到 {@link #MAX_CARD_NUM_LIMIT} 之间）
 * @param initialDrawNum 开局每位玩家先抽的张数
 */
public record GameSettings(List<CardColor> cardColors, int maxCardNumber, int initialDrawNum) {

    public static final int MAX_CARD_NUM_DEFAULT = 11;
    public static final int MAX_CARD_NUM_LIMIT = 99;
    public static final int COLOR_VARIANTS_MIN = 2;
    public static final int INITIAL_DRAW_NUM = 4;
    public static final int PLAYER_NUM = 2;

    public GameSettings {
        cardColors = cardColors == null ? List.of() : List.copyOf(cardColors);
    }

    public static GameSettings defaults() {
        return new GameSettings(List.of(CardColor.BLACK, CardColor.WHITE), MAX_CARD_NUM_DEFAULT, INITIAL_DRAW_NUM);
    }

    /**
     * 整副牌的张数：(maxCardNumber + 1) × 颜色数。
     */
    public long cardCount() {
        return ((long) maxCardNumber + 1) * cardColors.size();
    }

    /**
     * 检查配置能否开一局两人对局：发完初始手牌后牌堆里至少还剩一张。
     *
     * @throws GameSetupException 颜色过少或重复、最大数字越界、初始张数为负或牌不够发
     */
    public void validate() {
        if (cardColors.size() < COLOR_VARIANTS_MIN) {
            throw new GameSetupException("there must be at least " + COLOR_VARIANTS_MIN + " card colors");
        }
        if (cardColors.stream().distinct().count() != cardColors.size()) {
            throw new GameSetupException("duplicated card color: " + cardColors);
        }
        if (maxCardNumber < MAX_CARD_NUM_DEFAULT) {
            throw new GameSetupException("max_card_number must not be less than " + MAX_CARD_NUM_DEFAULT);
        }
        if (maxCardNumber > MAX_CARD_NUM_LIMIT) {
            throw new GameSetupException("max_card_number must not be greater than " + MAX_CARD_NUM_LIMIT);
        }
        if (initialDrawNum < 0) {
            throw new GameSetupException("initial_draw_num must not be negative");
        }
        if (cardCount() <= (long) initialDrawNum * PLAYER_NUM) {
            throw new GameSetupException("invalid game settings: not enough cards to start the game ("
                    + cardCount() + " cards, initial_draw_num=" + initialDrawNum + ")");
        }
    }

    /**
     * 生成整副牌：数字 × 颜色 的笛卡尔积。
     *
     * @throws GameSetupException 配置不合法，见 {@link #validate()}
     */
    public List<Card> buildCards() {
        validate();
        List<Card> cards = new ArrayList<>((int) cardCount());
        for (int n = 0; n <= maxCardNumber; n++) {
            for (CardColor color : cardColors) {
                cards.add(Card.of(n, color));
            }
        }
        return cards;
    }

    /** 数字是否在配置范围内 */
    public boolean isValidNumber(int number) {
        return number >= 0 && number <= maxCardNumber;
    }
}
