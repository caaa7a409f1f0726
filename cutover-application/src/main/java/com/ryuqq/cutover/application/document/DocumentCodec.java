package com.ryuqq.cutover.application.document;

import com.ryuqq.cutover.core.model.Payload;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.spi.RecordValidationException;

import java.time.Instant;

/**
 * 문서 타입별 직렬화 및 쓰기 규칙.
 *
 * <p>Store Adapter는 Payload를 해석하지 않으므로, 코디네이터와 fallback은 이 코덱을 통해
 * 문서를 읽고 씁니다.</p>
 *
 * @param <T> 문서 타입
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public interface DocumentCodec<T> {

    /**
     * Payload를 문서로 변환.
     *
     * @param key 레코드 키 (오류 메시지용)
     * @param payload 저장된 Payload
     * @return 문서
     * @throws RecordValidationException 형식이 맞지 않는 경우
     */
    T decode(RecordKey key, Payload payload);

    /**
     * 문서를 Payload로 변환.
     *
     * @param document 문서
     * @return Payload
     */
    Payload encode(T document);

    /**
     * 키가 없을 때 mutator에 넘길 빈 문서.
     *
     * @param key 레코드 키
     * @return 빈 문서
     */
    T blank(RecordKey key);

    /**
     * 문서의 updatedAt을 찍은 새 문서.
     *
     * @param document 문서
     * @param updatedAt 쓰기 시각
     * @return 새 문서
     */
    T stamp(T document, Instant updatedAt);

    /**
     * 쓰기 직전 문서가 키와 일관적인지 확인.
     *
     * @param key 레코드 키
     * @param document 쓸 문서
     * @throws RecordValidationException 불일치 시
     */
    default void verify(RecordKey key, T document) {
    }
}
