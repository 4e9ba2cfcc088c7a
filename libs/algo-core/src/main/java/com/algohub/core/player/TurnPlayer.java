package com.algohub.core.player;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * 行动顺序：队首为当前回合玩家，advance 把队首移到队尾。
 */
public class TurnPlayer {

    private final Deque<PlayerId> ids;

    public TurnPlayer(List<PlayerId> order) {
        this.ids = new ArrayDeque<>(order);
    }

    public Optional<PlayerId> current() {
        return Optional.ofNullable(ids.peekFirst());
    }

    public void advance() {
        PlayerId id = ids.pollFirst();
        if (id == null) {
            throw new IllegalStateException("turn order is empty");
        }
        ids.addLast(id);
    }

    public List<PlayerId> turnOrder() {
        return List.copyOf(ids);
    }
}
