package com.algohub.gameservice.platform.ws;

import com.algohub.protocol.codec.EnvelopeCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 消息编解码器，基于 Spring 管理的 ObjectMapper。
 */
@Configuration
public class CodecConfig {

    @Bean
    public EnvelopeCodec envelopeCodec(ObjectMapper objectMapper) {
        return new EnvelopeCodec(objectMapper);
    }
}
