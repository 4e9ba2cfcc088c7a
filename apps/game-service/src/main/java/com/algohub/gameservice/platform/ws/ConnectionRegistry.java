package com.algohub.gameservice.platform.ws;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 当前打开的（已被接纳的）连接，按 sessionId 索引。
 */
@Component
public class ConnectionRegistry {

    private final Map<String, PlayerConnection> connections = new ConcurrentHashMap<>();

    public void add(PlayerConnection connection) {
        connections.put(connection.id(), connection);
    }

    public Optional<PlayerConnection> get(String sessionId) {
        return Optional.ofNullable(connections.get(sessionId));
    }

    public Optional<PlayerConnection> remove(String sessionId) {
        return Optional.ofNullable(connections.remove(sessionId));
    }

    public List<PlayerConnection> all() {
        return List.copyOf(connections.values());
    }

    public int size() {
        return connections.size();
    }
}
