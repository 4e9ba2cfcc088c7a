package com.algohub.core.engine;

import com.algohub.core.card.Talon;
import com.algohub.core.exception.UnknownPlayerException;
import com.algohub.core.player.Player;
import com.algohub.core.player.PlayerId;
import com.algohub.core.player.PlayerView;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 盘面：牌堆 + 各玩家的牌。视图按需派生，不保存。
 */
class Board {

    private final Talon talon;
    private final SortedMap<PlayerId, Player> players;

    Board(Talon talon, Map<PlayerId, Player> players) {
        this.talon = talon;
        this.players = new TreeMap<>(players);
    }

    Talon talon() {
        return talon;
    }

    Player player(PlayerId id) {
        Player player = players.get(id);
        if (player == null) {
            throw new UnknownPlayerException(id);
        }
        return player;
    }

    Set<PlayerId> playerIds() {
        return players.keySet();
    }

    BoardView view(PlayerId viewer) {
        PlayerView myself = player(viewer).ownerView(viewer);
        List<PlayerView> others = players.entrySet().stream()
                .filter(e -> !e.getKey().equals(viewer))
                .map(e -> e.getValue().publicView(e.getKey()))
                .toList();
        return new BoardView(myself, others, talon.size(), talon.viewTop().orElse(null));
    }
}
