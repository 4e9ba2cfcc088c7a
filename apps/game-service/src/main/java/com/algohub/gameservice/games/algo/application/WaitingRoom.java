package com.algohub.gameservice.games.algo.application;

import com.algohub.core.engine.Game;
import com.algohub.core.player.PlayerId;
import com.algohub.core.player.PlayerIdAllocator;
import com.algohub.core.settings.GameSettings;
import com.algohub.protocol.Envelope;
import com.algohub.protocol.message.ClientToServerEvent;
import com.algohub.protocol.message.JoinInfo;
import com.algohub.protocol.message.ServerToClientEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * 等待室：给每个入座请求分配 PlayerId，凑齐两人后交给 {@link GameInstance}。
 * 等待期间断线的玩家让出座位。
 */
@Slf4j
public class WaitingRoom {

    private final RoomInbox inbox;
    private final GameSettings settings;
    private final int maxInvalidResponses;
    private final Consumer<List<PlayerId>> seatsListener;

    private final SortedMap<PlayerId, PlayerHandler> playerHandlers = new TreeMap<>();
    private final WaitingRoomSeats room = new WaitingRoomSeats();
    private final PlayerIdAllocator newPlayerId = new PlayerIdAllocator();

    /**
     * @param seatsListener 座位变化时回调（在房间线程上调用）
     */
    public WaitingRoom(RoomInbox inbox, GameSettings settings, int maxInvalidResponses,
                       Consumer<List<PlayerId>> seatsListener) {
        this.inbox = inbox;
        this.settings = settings;
        this.maxInvalidResponses = maxInvalidResponses;
        this.seatsListener = seatsListener;
    }

    /**
     * 等到满员。
     *
     * @return 满员后创建的对局实例；服务关闭时返回 empty
     * @throws com.algohub.core.exception.GameSetupException 对局配置不合法（此时还未接受任何入座）
     */
    public Optional<GameInstance> run() {
        settings.validate();
        while (!room.isFull()) {
            ServerInternalEvent ev;
            try {
                ev = inbox.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }

            if (ev instanceof ServerInternalEvent.RequestJoin join) {
                onRequestJoin(join.channel(), join.request());
            } else if (ev instanceof ServerInternalEvent.ConnectionLost lost) {
                onConnectionLost(lost.channel());
            } else if (ev instanceof ServerInternalEvent.Shutdown) {
                return Optional.empty();
            } else {
                log.warn("unexpected event in waiting room: {}", ev);
            }
        }

        PlayerId first = playerHandlers.firstKey();
        PlayerId second = playerHandlers.lastKey();
        Game game = Game.for2Players(first, second, settings);
        return Optional.of(new GameInstance(inbox, game, playerHandlers, maxInvalidResponses));
    }

    private void onRequestJoin(ClientChannel channel, Envelope<ClientToServerEvent> request) {
        if (findSeated(channel).isPresent()) {
            log.warn("connection {} has already joined", channel.id());
            channel.sendEvent(Envelope.responseTo(request,
                    new ServerToClientEvent.ErrorMessage("already joined")));
            return;
        }
        PlayerId playerId = newPlayerId.assign();
        JoinInfo joinInfo = room.tryClaim(playerId);

        PlayerHandler handler = new PlayerHandler(playerId, channel);
        handler.replyJoinAccepted(request, joinInfo);

        // 通知已在等待的玩家
        for (PlayerHandler waiting : playerHandlers.values()) {
            waiting.sendMessage(new ServerToClientEvent.PlayerJoined(joinInfo));
        }
        playerHandlers.put(playerId, handler);
        log.info("玩家 {} 入座 ({}/{})", playerId, room.playerNum(), WaitingRoomSeats.ROOM_SIZE);
        seatsListener.accept(room.players());
    }

    private void onConnectionLost(ClientChannel channel) {
        Optional<PlayerHandler> seated = findSeated(channel);
        if (seated.isEmpty()) {
            log.debug("ignore ConnectionLost of unseated connection: {}", channel.id());
            return;
        }
        PlayerId playerId = seated.get().getPlayerId();
        log.info("玩家 {} 离开了等待室", playerId);
        room.remove(playerId);
        playerHandlers.remove(playerId);
        seatsListener.accept(room.players());
    }

    private Optional<PlayerHandler> findSeated(ClientChannel channel) {
        return playerHandlers.values().stream()
                .filter(h -> h.getChannel().id().equals(channel.id()))
                .findFirst();
    }
}
