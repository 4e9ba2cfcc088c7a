package com.algohub.gameservice.config;

import com.algohub.protocol.ProtocolConstants;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * 房间与连接相关配置（algo.server.*）。
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "algo.server")
public class AlgoServerProperties {

    /**
     * 同时接入的连接上限（信号量许可数）
     */
    @Min(1)
    private int roomCapacity = 2;

    /**
     * 同一步骤允许的连续非法响应次数，超过后终止对局
     */
    @Min(1)
    private int maxInvalidResponses = 3;

    /**
     * WebSocket 端点
     */
    @NotBlank
    private String endpoint = ProtocolConstants.DEFAULT_ENDPOINT;
}
