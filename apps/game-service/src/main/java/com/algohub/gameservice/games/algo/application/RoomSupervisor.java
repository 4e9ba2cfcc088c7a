package com.algohub.gameservice.games.algo.application;

import com.algohub.core.player.PlayerId;
import com.algohub.gameservice.config.AlgoGameProperties;
import com.algohub.gameservice.config.AlgoServerProperties;
import com.algohub.gameservice.platform.ws.ConnectionRegistry;
import com.algohub.gameservice.platform.ws.PlayerConnection;
import com.algohub.protocol.message.ServerToClientEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 房间生命周期：等待室 → 对局 → 关闭本局连接 → 新的等待室 …
 * <p>
 * 整个循环跑在 roomExecutor 的单个线程上。应用关闭时投递 Shutdown，
 * 等房间线程退出后向所有仍打开的连接发送 ServerShutdown 并关闭。
 */
@Slf4j
@Component
public class RoomSupervisor implements SmartLifecycle {

    private static final long STOP_TIMEOUT_SECONDS = 5;

    private final RoomInbox inbox;
    private final ConnectionRegistry registry;
    private final ExecutorService roomExecutor;
    private final AlgoServerProperties serverProperties;
    private final AlgoGameProperties gameProperties;

    private final AtomicReference<RoomStatus> status;
    private final AtomicInteger matchesPlayed = new AtomicInteger();
    private volatile boolean running;
    private Future<?> roomTask;

    public RoomSupervisor(RoomInbox inbox,
                          ConnectionRegistry registry,
                          @Qualifier("roomExecutor") ExecutorService roomExecutor,
                          AlgoServerProperties serverProperties,
                          AlgoGameProperties gameProperties) {
        this.inbox = inbox;
        this.registry = registry;
        this.roomExecutor = roomExecutor;
        this.serverProperties = serverProperties;
        this.gameProperties = gameProperties;
        this.status = new AtomicReference<>(
                new RoomStatus(RoomPhase.WAITING, List.of(), WaitingRoomSeats.ROOM_SIZE, 0));
    }

    @Override
    public void start() {
        running = true;
        roomTask = roomExecutor.submit(this::runRooms);
        log.info("房间已开放: capacity={}, endpoint={}",
                serverProperties.getRoomCapacity(), serverProperties.getEndpoint());
    }

    @Override
    public void stop() {
        running = false;
        inbox.submit(new ServerInternalEvent.Shutdown());
        if (roomTask != null) {
            try {
                roomTask.get(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                log.warn("房间线程未在 {}s 内退出", STOP_TIMEOUT_SECONDS);
                roomTask.cancel(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                log.error("房间线程异常退出", e);
            }
        }
        closeAll();
        log.info("房间已关闭: matchesPlayed={}", matchesPlayed.get());
    }

    /** 通知所有仍打开的连接服务已停止并关闭 */
    private void closeAll() {
        for (PlayerConnection connection : registry.all()) {
            connection.sendRequest(new ServerToClientEvent.ServerShutdown());
            connection.close();
        }
        updateStatus(RoomPhase.STOPPED, List.of());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public RoomStatus status() {
        return status.get();
    }

    private void runRooms() {
        while (running) {
            updateStatus(RoomPhase.WAITING, List.of());
            WaitingRoom waitingRoom = new WaitingRoom(inbox, gameProperties.toSettings(),
                    serverProperties.getMaxInvalidResponses(),
                    players -> updateStatus(RoomPhase.WAITING, players));

            Optional<GameInstance> instance;
            try {
                instance = waitingRoom.run();
            } catch (RuntimeException e) {
                log.error("等待室异常，停止开放房间", e);
                closeAll();
                return;
            }
            if (instance.isEmpty()) {
                return;
            }

            GameInstance match = instance.get();
            updateStatus(RoomPhase.PLAYING, match.players());
            MatchOutcome outcome;
            try {
                outcome = match.run();
            } catch (RuntimeException e) {
                log.error("对局异常终止: players={}", match.players(), e);
                outcome = MatchOutcome.ABORTED;
            }
            matchesPlayed.incrementAndGet();
            log.info("对局结束: outcome={}, players={}", outcome, match.players());
            if (outcome == MatchOutcome.SHUTDOWN) {
                return;
            }
            match.closeConnections();
        }
    }

    private void updateStatus(RoomPhase phase, List<PlayerId> players) {
        status.set(new RoomStatus(phase, players, WaitingRoomSeats.ROOM_SIZE, matchesPlayed.get()));
    }
}
