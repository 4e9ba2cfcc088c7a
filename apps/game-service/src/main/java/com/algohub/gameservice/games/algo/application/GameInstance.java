package com.algohub.gameservice.games.algo.application;

import com.algohub.core.engine.Game;
import com.algohub.core.event.GameEvent;
import com.algohub.core.exception.NextEventException;
import com.algohub.core.exception.ProcessEventException;
import com.algohub.core.player.PlayerId;
import com.algohub.protocol.Envelope;
import com.algohub.protocol.message.ServerToClientEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 一局对局的驱动循环，运行在房间线程上，独占 {@link Game}。
 * <p>
 * 每一步：
 * 1. 向 Game 要下一个事件；没有了就结束；
 * 2. 把各玩家视角的事件推给各自的连接；
 * 3. 从收件队列等待所有玩家响应，逐个交给 Game；
 * 4. 收齐后由 Game 校验并应用。
 * 非法响应：给出错玩家发 Error，丢弃其响应并以新 id 重新询问；同一步骤连续超过上限则终止对局。
 */
@Slf4j
public class GameInstance {

    private final RoomInbox inbox;
    private final Game game;
    private final SortedMap<PlayerId, PlayerHandler> playerHandlers;
    private final int maxInvalidResponses;

    public GameInstance(RoomInbox inbox, Game game, Map<PlayerId, PlayerHandler> playerHandlers,
                        int maxInvalidResponses) {
        this.inbox = inbox;
        this.game = game;
        this.playerHandlers = new TreeMap<>(playerHandlers);
        this.maxInvalidResponses = maxInvalidResponses;
    }

    public Game game() {
        return game;
    }

    public List<PlayerId> players() {
        return List.copyOf(playerHandlers.keySet());
    }

    /**
     * 运行到对局结束、被终止或服务关闭。
     *
     * @throws IllegalStateException 引擎状态异常（程序错误）
     */
    public MatchOutcome run() {
        log.info("对局开始: players={}", playerHandlers.keySet());
        while (true) {
            SortedMap<PlayerId, GameEvent> eventForEachPlayer;
            try {
                eventForEachPlayer = game.nextEvent();
            } catch (NextEventException e) {
                if (e.getReason() == NextEventException.Reason.NO_MORE_EVENT) {
                    log.info("对局结束: players={}, events={}", playerHandlers.keySet(), game.history().size());
                    return MatchOutcome.FINISHED;
                }
                throw new IllegalStateException("server internal error: unexpected game state", e);
            }

            for (Map.Entry<PlayerId, GameEvent> e : eventForEachPlayer.entrySet()) {
                log.debug("new GameEvent for {}: {}", e.getKey(), e.getValue());
                handler(e.getKey()).sendGameEvent(e.getValue());
            }

            Optional<MatchOutcome> outcome = collectResponses();
            if (outcome.isPresent()) {
                return outcome.get();
            }
        }
    }

    /**
     * 等待并处理当前步骤的全部响应。
     *
     * @return 需要结束对局时返回结束方式；步骤完成时返回 empty
     */
    private Optional<MatchOutcome> collectResponses() {
        int invalidResponses = 0;
        while (true) {
            ServerInternalEvent ev;
            try {
                ev = inbox.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("房间线程被中断，结束对局");
                return Optional.of(MatchOutcome.SHUTDOWN);
            }

            if (ev instanceof ServerInternalEvent.Shutdown) {
                return Optional.of(MatchOutcome.SHUTDOWN);
            }
            if (ev instanceof ServerInternalEvent.RequestJoin join) {
                if (findHandler(join.channel()).isPresent()) {
                    log.warn("connection {} has already joined", join.channel().id());
                    join.channel().sendEvent(Envelope.responseTo(join.request(),
                            new ServerToClientEvent.ErrorMessage("already joined")));
                    continue;
                }
                log.warn("对局进行中，拒绝入座请求: connection={}", join.channel().id());
                join.channel().sendEvent(Envelope.responseTo(join.request(),
                        new ServerToClientEvent.ErrorMessage("room is full")));
                join.channel().close();
                continue;
            }
            if (ev instanceof ServerInternalEvent.ConnectionLost lost) {
                onConnectionLost(lost.channel());
                continue;
            }
            if (ev instanceof ServerInternalEvent.In in) {
                Optional<PlayerHandler> sender = findHandler(in.channel());
                if (sender.isEmpty()) {
                    log.warn("unknown connection: {}", in.channel().id());
                    continue;
                }
                PlayerHandler handler = sender.get();
                Optional<GameEvent> response = handler.checkForGameEventResponse(in.envelope());
                if (response.isEmpty()) {
                    continue;
                }
                if (!game.storePlayerResponse(handler.getPlayerId(), response.get())) {
                    continue;
                }
                try {
                    game.processEvent();
                    return Optional.empty();
                } catch (ProcessEventException e) {
                    if (e.getReason() != ProcessEventException.Reason.INVALID_RESPONSE) {
                        throw e;
                    }
                    invalidResponses++;
                    if (rePrompt(e, invalidResponses)) {
                        continue;
                    }
                    return Optional.of(MatchOutcome.ABORTED);
                }
            }
        }
    }

    /**
     * 通知出错玩家并重新询问。
     *
     * @return false 表示已超过上限，对局应终止
     */
    private boolean rePrompt(ProcessEventException e, int invalidResponses) {
        PlayerId offender = e.getPlayer();
        log.warn("非法响应 ({}/{}): {}", invalidResponses, maxInvalidResponses, e.getMessage());
        if (invalidResponses >= maxInvalidResponses) {
            String message = "match aborted: too many invalid responses from " + offender;
            log.error(message);
            playerHandlers.values().forEach(h -> h.sendError(message));
            return false;
        }
        PlayerHandler handler = handler(offender);
        handler.sendError(e.getMessage());
        game.discardResponse(offender);
        handler.resendGameEvent();
        return true;
    }

    private void onConnectionLost(ClientChannel channel) {
        Optional<PlayerHandler> lost = findHandler(channel);
        if (lost.isEmpty()) {
            log.debug("ignore ConnectionLost of unknown connection: {}", channel.id());
            return;
        }
        PlayerHandler handler = lost.get();
        if (!handler.isConnected()) {
            return;
        }
        handler.markDisconnected();
        PlayerId playerId = handler.getPlayerId();
        log.info("玩家 {} 在对局中断开连接", playerId);
        playerHandlers.values().stream()
                .filter(h -> !h.getPlayerId().equals(playerId))
                .forEach(h -> h.notifyPlayerDisconnected(playerId));
    }

    /** 关闭本局所有连接 */
    public void closeConnections() {
        playerHandlers.values().forEach(PlayerHandler::close);
    }

    private Optional<PlayerHandler> findHandler(ClientChannel channel) {
        return playerHandlers.values().stream()
                .filter(h -> h.getChannel().id().equals(channel.id()))
                .findFirst();
    }

    private PlayerHandler handler(PlayerId playerId) {
        PlayerHandler handler = playerHandlers.get(playerId);
        if (handler == null) {
            throw new IllegalStateException("server internal error: unknown player: " + playerId);
        }
        return handler;
    }
}
