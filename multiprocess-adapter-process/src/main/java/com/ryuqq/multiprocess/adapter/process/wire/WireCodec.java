package com.ryuqq.multiprocess.adapter.process.wire;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * ChannelMessage JSON 코덱.
 *
 * <p>메시지 하나는 줄바꿈 없는 JSON 한 줄입니다 (문자열 안의 줄바꿈은 이스케이프됨).
 * null 필드는 생략합니다.</p>
 *
 * <p>옵션의 정수는 Long으로 디코딩합니다. {@link com.ryuqq.multiprocess.core.model.Options}가 정수를
 * Long으로 정규화하므로 보낸 옵션과 받은 옵션이 equals로 같습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WireCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .setSerializationInclusion(JsonInclude.Include.NON_NULL)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(DeserializationFeature.USE_LONG_FOR_INTS);

    private WireCodec() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 메시지를 한 줄의 JSON으로 인코딩.
     *
     * @param message 메시지
     * @return JSON (줄바꿈 없음)
     * @throws WireFormatException 직렬화할 수 없는 옵션 값이 있는 경우
     */
    public static String encode(ChannelMessage message) {
        try {
            return MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new WireFormatException("Failed to encode " + message.type() + " message: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * JSON 한 줄을 메시지로 디코딩.
     *
     * @param line JSON
     * @return 메시지
     * @throws WireFormatException 형식이 잘못된 경우
     */
    public static ChannelMessage decode(String line) {
        try {
            return MAPPER.readValue(line, ChannelMessage.class);
        } catch (JsonProcessingException e) {
            throw new WireFormatException("Malformed channel message: " + e.getOriginalMessage(), e);
        }
    }
}
