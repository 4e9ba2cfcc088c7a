package com.algohub.protocol.codec;

/**
 * 入站文本无法解码。
 */
public class MalformedMessageException extends IllegalArgumentException {

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
