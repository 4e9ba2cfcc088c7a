package com.algohub.protocol;

/**
 * 客户端与服务端共用的常量。
 */
public final class ProtocolConstants {

    /** 默认服务端口 */
    public static final int DEFAULT_SERVER_PORT = 54345;

    /** WebSocket 端点 */
    public static final String DEFAULT_ENDPOINT = "/algo";

    private ProtocolConstants() {
    }
}
