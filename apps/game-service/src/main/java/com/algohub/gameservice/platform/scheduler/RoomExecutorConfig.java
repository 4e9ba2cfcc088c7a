package com.algohub.gameservice.platform.scheduler;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 房间线程：等待室和对局实例都跑在这一个线程上，对局状态只由它修改。
 * WebSocket 容器线程只负责收发转发。
 */
@Configuration
public class RoomExecutorConfig {

    @Bean(name = "roomExecutor", destroyMethod = "shutdownNow")
    public ExecutorService roomExecutor() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "room-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        return Executors.newSingleThreadExecutor(tf);
    }
}
