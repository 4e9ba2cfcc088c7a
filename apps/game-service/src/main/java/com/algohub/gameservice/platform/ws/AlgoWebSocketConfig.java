package com.algohub.gameservice.platform.ws;

import com.algohub.gameservice.config.AlgoServerProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * WebSocket 配置类
 * ----------------------------------------
 * 客户端连接地址：ws://host:54345/algo（端点可通过 algo.server.endpoint 修改）。
 * 每个文本帧是一条 JSON 编码的消息外壳。
 */
@Configuration
@EnableWebSocket
public class AlgoWebSocketConfig implements WebSocketConfigurer {

    private final AlgoWebSocketHandler handler;
    private final AlgoServerProperties properties;

    public AlgoWebSocketConfig(AlgoWebSocketHandler handler, AlgoServerProperties properties) {
        this.handler = handler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, properties.getEndpoint())
                .setAllowedOriginPatterns("*"); // 允许跨域访问（开发时用 *，生产建议限制域名）
    }
}
