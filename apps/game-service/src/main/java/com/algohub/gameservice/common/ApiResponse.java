package com.algohub.gameservice.common;

import java.io.Serializable;

/**
 * 统一 API 响应格式
 *
 * @param code    200 成功；400 参数错误；404 资源不存在；409 状态冲突；500 服务器错误
 * @param message 响应消息
 * @param data    响应数据
 */
public record ApiResponse<T>(int code, String message, T data) implements Serializable {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", data);
    }

    /**
     * 失败响应（400 Bad Request）
     */
    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(400, message, null);
    }

    /**
     * 失败响应（409 Conflict）
     */
    public static <T> ApiResponse<T> conflict(String message) {
        return new ApiResponse<>(409, message, null);
    }

    /**
     * 失败响应（500 Internal Server Error）
     */
    public static <T> ApiResponse<T> serverError(String message) {
        return new ApiResponse<>(500, message, null);
    }
}
