package com.algohub.core.exception;

/**
 * 创建对局失败：玩家 ID 重复、牌数不足、颜色过少、最大数字低于下限等。
 */
public class GameSetupException extends IllegalArgumentException {

    public GameSetupException(String message) {
        super(message);
    }
}
