package com.algohub.core.engine;

import com.algohub.core.card.CardView;
import com.algohub.core.player.PlayerView;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 某个玩家视角下的盘面：自己的牌全部可见，其他玩家只看得到公开信息。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BoardView(PlayerView myself,
                        List<PlayerView> otherPlayers,
                        int talonRemaining,
                        CardView talonTop) {

    public BoardView {
        otherPlayers = List.copyOf(otherPlayers);
    }
}
