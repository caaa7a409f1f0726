package com.ryuqq.cutover.application.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.cutover.core.model.Payload;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.spi.RecordValidationException;

/**
 * Jackson 기반 {@link DocumentCodec}.
 *
 * <p>역직렬화 실패와 생성자 검증 실패는 모두 {@link RecordValidationException}으로 변환됩니다.</p>
 *
 * @param <T> 문서 타입
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public abstract class JsonDocumentCodec<T> implements DocumentCodec<T> {

    private final ObjectMapper objectMapper;
    private final Class<T> type;

    protected JsonDocumentCodec(ObjectMapper objectMapper, Class<T> type) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        this.objectMapper = objectMapper;
        this.type = type;
    }

    @Override
    public T decode(RecordKey key, Payload payload) {
        try {
            T document = objectMapper.readValue(payload.getValue(), type);
            if (document == null) {
                throw new RecordValidationException("Empty " + type.getSimpleName() + " document at " + key);
            }
            return document;
        } catch (JsonProcessingException e) {
            throw new RecordValidationException(
                "Malformed " + type.getSimpleName() + " document at " + key + ": " + e.getOriginalMessage());
        }
    }

    @Override
    public Payload encode(T document) {
        try {
            return Payload.of(objectMapper.writeValueAsString(document));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + type.getSimpleName(), e);
        }
    }

    protected ObjectMapper objectMapper() {
        return objectMapper;
    }
}
