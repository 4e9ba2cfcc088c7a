package com.algohub.gameservice.games.algo.application;

import org.springframework.stereotype.Component;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * 房间线程的收件队列：所有连接线程往里投递，房间线程按到达顺序取出。
 */
@Component
public class RoomInbox {

    private final BlockingQueue<ServerInternalEvent> queue = new LinkedBlockingQueue<>();

    public void submit(ServerInternalEvent event) {
        queue.add(event);
    }

    public ServerInternalEvent take() throws InterruptedException {
        return queue.take();
    }

    public int size() {
        return queue.size();
    }
}
