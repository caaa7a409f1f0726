package com.ryuqq.cutover.core.model;

import java.util.UUID;

/**
 * 호출 추적용 상관관계 식별자.
 *
 * <p>외부에서 전달받아 모든 어댑터 호출에 실어 보내며, 구조화 로그에만 사용됩니다.
 * 동작에는 영향을 주지 않습니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class CorrelationId {

    private final String value;

    private CorrelationId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CorrelationId cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * CorrelationId 생성.
     *
     * @param value 식별자 문자열
     * @return CorrelationId 인스턴스
     * @throws IllegalArgumentException 값이 null이거나 공백인 경우
     */
    public static CorrelationId of(String value) {
        return new CorrelationId(value);
    }

    /**
     * UUID 기반 새 식별자 생성.
     *
     * @return 새 CorrelationId
     */
    public static CorrelationId newId() {
        return new CorrelationId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CorrelationId that = (CorrelationId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
