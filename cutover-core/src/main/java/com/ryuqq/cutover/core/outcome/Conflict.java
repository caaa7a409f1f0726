package com.ryuqq.cutover.core.outcome;

import com.ryuqq.cutover.core.model.RecordKey;

/**
 * 버전 충돌 결과.
 *
 * <p>다른 writer가 먼저 같은 키를 갱신했음을 나타냅니다.
 * 코디네이터 내부의 1회 재시도 이후에도 충돌하면 이 결과가 호출자에게 전달됩니다.</p>
 *
 * @param key 충돌한 레코드 키
 * @param reason 충돌 사유
 * @param <T> 문서 타입
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public record Conflict<T>(
    RecordKey key,
    String reason
) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Conflict {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }
}
