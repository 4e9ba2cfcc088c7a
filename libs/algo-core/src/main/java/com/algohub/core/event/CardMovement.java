package com.algohub.core.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 卡牌移动。insertAt 为持有者视角从左数的下标。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CardMovement.TalonToField.class, name = "TalonToField"),
        @JsonSubTypes.Type(value = CardMovement.TalonToAttacker.class, name = "TalonToAttacker"),
        @JsonSubTypes.Type(value = CardMovement.AttackerToField.class, name = "AttackerToField")
})
public sealed interface CardMovement {

    record TalonToField(int insertAt) implements CardMovement {
    }

    record TalonToAttacker() implements CardMovement {
    }

    record AttackerToField(int insertAt) implements CardMovement {
    }
}
