package com.algohub.gameservice.config;

import com.algohub.core.card.CardColor;
import com.algohub.core.settings.GameSettings;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * 对局规则配置（algo.game.*），每局开始时转成 {@link GameSettings}。
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "algo.game")
public class AlgoGameProperties {

    @Size(min = GameSettings.COLOR_VARIANTS_MIN)
    private List<CardColor> cardColors = new ArrayList<>(List.of(CardColor.BLACK, CardColor.WHITE));

    @Min(GameSettings.MAX_CARD_NUM_DEFAULT)
    @Max(GameSettings.MAX_CARD_NUM_LIMIT)
    private int maxCardNumber = GameSettings.MAX_CARD_NUM_DEFAULT;

    @Min(0)
    private int initialDrawNum = GameSettings.INITIAL_DRAW_NUM;

    /**
     * 各字段单独合法时，整副牌仍可能不够发初始手牌，启动时一并检查。
     */
    @AssertTrue(message = "not enough cards to deal the initial hands")
    public boolean isDeckLargeEnough() {
        return toSettings().cardCount() > (long) initialDrawNum * GameSettings.PLAYER_NUM;
    }

    public GameSettings toSettings() {
        return new GameSettings(cardColors, maxCardNumber, initialDrawNum);
    }
}
