package com.algohub.core.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 卡牌位置。不含牌堆：牌堆里的牌不会被翻开。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CardLocation.Field.class, name = "Field"),
        @JsonSubTypes.Type(value = CardLocation.Attacker.class, name = "Attacker")
})
public sealed interface CardLocation {

    /** 手牌区，idx 为持有者视角从左数的下标 */
    record Field(int idx) implements CardLocation {
    }

    /** 回合玩家抽到的进攻牌 */
    record Attacker() implements CardLocation {
    }
}
