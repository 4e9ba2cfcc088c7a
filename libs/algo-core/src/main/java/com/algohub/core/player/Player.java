package com.algohub.core.player;

import com.algohub.core.card.Card;
import com.algohub.core.card.CardView;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 玩家的牌面状态。
 * - field：按 (数字, 颜色) 排序且不重复
 * - attacker：本回合抽到、正在用来进攻的那张牌（最多一张）
 */
public class Player {

    private final List<Card> field = new ArrayList<>();
    private Card attacker;

    /**
     * 把牌插入手牌区的有序位置。
     *
     * @return 插入后的下标（从持有者视角的左侧数起）
     * @throws IllegalStateException 手牌区已有同一张牌
     */
    public int insertCardToField(Card card) {
        int idx = Collections.binarySearch(field, card);
        if (idx >= 0) {
            throw new IllegalStateException("duplicated card detected: " + card);
        }
        int insertAt = -(idx + 1);
        field.add(insertAt, card);
        return insertAt;
    }

    /**
     * @throws IllegalStateException 已有 attacker
     */
    public void insertAttacker(Card card) {
        if (attacker != null) {
            throw new IllegalStateException("attacker already exists: " + attacker);
        }
        attacker = card;
    }

    public Optional<Card> attacker() {
        return Optional.ofNullable(attacker);
    }

    /** 翻开 attacker */
    public Card revealAttacker() {
        attacker = requireAttacker().reveal();
        return attacker;
    }

    /**
     * 把 attacker 收进手牌区（保持当前翻开状态）。
     *
     * @return 插入下标
     */
    public int foldAttackerIntoField() {
        Card card = requireAttacker();
        attacker = null;
        return insertCardToField(card);
    }

    /** 翻开手牌区指定下标的牌，返回翻开后的牌 */
    public Card revealAt(int idx) {
        Card revealed = field.get(idx).reveal();
        field.set(idx, revealed);
        return revealed;
    }

    public Card cardAt(int idx) {
        return field.get(idx);
    }

    public int fieldSize() {
        return field.size();
    }

    public List<Card> field() {
        return Collections.unmodifiableList(field);
    }

    /** 手牌区是否已全部翻开 */
    public boolean isFieldAllRevealed() {
        return field.stream().allMatch(Card::revealed);
    }

    /** 持有者自己看到的视图 */
    public PlayerView ownerView(PlayerId id) {
        return new PlayerView(id,
                field.stream().map(CardView::full).toList(),
                attacker == null ? null : CardView.full(attacker));
    }

    /** 其他玩家看到的视图 */
    public PlayerView publicView(PlayerId id) {
        return new PlayerView(id,
                field.stream().map(Card::publicView).toList(),
                attacker == null ? null : attacker.publicView());
    }

    private Card requireAttacker() {
        if (attacker == null) {
            throw new IllegalStateException("attacker does not exist");
        }
        return attacker;
    }
}
