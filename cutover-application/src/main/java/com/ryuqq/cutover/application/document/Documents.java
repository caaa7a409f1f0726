package com.ryuqq.cutover.application.document;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * 문서 직렬화에 쓰는 ObjectMapper 구성.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class Documents {

    private Documents() {
    }

    /**
     * 공통 설정의 ObjectMapper 생성.
     *
     * <ul>
     *   <li>java.time 타입은 ISO-8601 문자열로 직렬화</li>
     *   <li>알 수 없는 필드는 실패하지 않음 (문서 타입은 extras로 보존)</li>
     * </ul>
     *
     * @return 새 ObjectMapper
     */
    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
