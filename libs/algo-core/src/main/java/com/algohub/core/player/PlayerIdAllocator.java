package com.algohub.core.player;

/**
 * 自增分配玩家 ID，从 1 开始。非线程安全，只在房间线程里使用。
 */
public class PlayerIdAllocator {

    private int last;

    public PlayerId assign() {
        last++;
        return new PlayerId(last);
    }
}
