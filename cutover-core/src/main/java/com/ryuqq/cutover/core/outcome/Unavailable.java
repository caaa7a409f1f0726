package com.ryuqq.cutover.core.outcome;

import com.ryuqq.cutover.core.model.RecordKey;

/**
 * 백엔드 접근 불가 결과.
 *
 * <p>어댑터 수준 재시도가 모두 소진된 후에도 첫 번째 대상에 쓰지 못한 경우입니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>네트워크 타임아웃 반복</li>
 *   <li>스로틀링 (429) 지속</li>
 *   <li>디스크 I/O 오류</li>
 * </ul>
 *
 * @param key 대상 레코드 키
 * @param backend 실패한 백엔드 이름
 * @param reason 실패 사유
 * @param <T> 문서 타입
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public record Unavailable<T>(
    RecordKey key,
    String backend,
    String reason
) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Unavailable {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (backend == null || backend.isBlank()) {
            throw new IllegalArgumentException("backend cannot be null or blank");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }
}
