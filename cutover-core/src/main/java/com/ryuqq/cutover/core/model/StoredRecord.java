package com.ryuqq.cutover.core.model;

import java.time.Instant;

/**
 * 저장소에서 읽은 레코드.
 *
 * <p>Payload와 함께 해당 시점의 버전 토큰과 갱신 시각을 담습니다.
 * 갱신 시각은 어댑터가 키 단위로 단조 증가하도록 부여합니다.</p>
 *
 * @param key 레코드 키
 * @param payload 직렬화된 문서
 * @param version 현재 버전 토큰
 * @param updatedAt 마지막 쓰기 시각
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public record StoredRecord(
    RecordKey key,
    Payload payload,
    VersionToken version,
    Instant updatedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null인 경우
     */
    public StoredRecord {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (version == null) {
            throw new IllegalArgumentException("version cannot be null");
        }
        if (updatedAt == null) {
            throw new IllegalArgumentException("updatedAt cannot be null");
        }
    }
}
