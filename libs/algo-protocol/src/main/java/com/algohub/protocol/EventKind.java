package com.algohub.protocol;

/** 消息类别：请求 / 对某个请求的响应 */
public enum EventKind {
    REQUEST,
    RESPONSE
}
