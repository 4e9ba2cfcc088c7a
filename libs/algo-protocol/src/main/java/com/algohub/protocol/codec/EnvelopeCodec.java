package com.algohub.protocol.codec;

import com.algohub.protocol.Envelope;
import com.algohub.protocol.message.ClientToServerEvent;
import com.algohub.protocol.message.ServerToClientEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * 消息外壳与 JSON 文本互转（一条消息对应一个 WebSocket 文本帧）。
 * 线程安全：ObjectMapper 配置完成后只读。
 */
public class EnvelopeCodec {

    private static final TypeReference<Envelope<ClientToServerEvent>> CLIENT_TO_SERVER = new TypeReference<>() {
    };
    private static final TypeReference<Envelope<ServerToClientEvent>> SERVER_TO_CLIENT = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final ObjectWriter serverWriter;
    private final ObjectWriter clientWriter;

    public EnvelopeCodec() {
        this(new ObjectMapper());
    }

    public EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        // 按声明类型写出，event 才会带上 type 标签
        this.serverWriter = this.mapper.writerFor(SERVER_TO_CLIENT);
        this.clientWriter = this.mapper.writerFor(CLIENT_TO_SERVER);
    }

    public String encodeServerEvent(Envelope<ServerToClientEvent> envelope) {
        return write(serverWriter, envelope);
    }

    public String encodeClientEvent(Envelope<ClientToServerEvent> envelope) {
        return write(clientWriter, envelope);
    }

    /**
     * @throws MalformedMessageException 文本不是合法的客户端消息
     */
    public Envelope<ClientToServerEvent> decodeClientEvent(String text) {
        return read(text, CLIENT_TO_SERVER);
    }

    /**
     * @throws MalformedMessageException 文本不是合法的服务端消息
     */
    public Envelope<ServerToClientEvent> decodeServerEvent(String text) {
        return read(text, SERVER_TO_CLIENT);
    }

    private String write(ObjectWriter writer, Envelope<?> value) {
        try {
            return writer.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to encode " + value, e);
        }
    }

    private <T> T read(String text, TypeReference<T> type) {
        try {
            return mapper.readValue(text, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedMessageException("malformed message: " + e.getMessage(), e);
        }
    }
}
