package com.algohub.core.card;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * 牌堆（talon）：所有牌洗乱后从末尾依次抽取，抽空即结束。
 */
public class Talon {

    private final List<Card> cards;

    public Talon(Collection<Card> cards) {
        this.cards = new ArrayList<>(cards);
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    public void shuffle(Random rng) {
        Collections.shuffle(cards, rng);
    }

    /** 抽一张（从末尾弹出）；牌堆为空时返回 empty */
    public Optional<Card> draw() {
        if (cards.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(cards.remove(cards.size() - 1));
    }

    /** 顶牌的公开视图 */
    public Optional<CardView> viewTop() {
        if (cards.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(cards.get(cards.size() - 1).publicView());
    }

    public TalonView view() {
        CardPubInfo top = cards.isEmpty() ? null : cards.get(cards.size() - 1).pubInfo();
        List<CardColor> colors = cards.stream().map(Card::color).toList();
        return new TalonView(top, cards.size(), colors);
    }
}
