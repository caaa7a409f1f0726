package com.ryuqq.cutover.core.protection;

/**
 * 어댑터 수준 재시도 정책 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>baseDelayMs: 첫 재시도 전 대기 시간 (기본 200ms)</li>
 *   <li>maxDelayMs: 재시도 간 최대 대기 시간 (기본 5000ms)</li>
 *   <li>maxRetries: 최초 호출 이후 최대 재시도 횟수 (기본 5)</li>
 *   <li>jitterFactor: Jitter 비율 (기본 0.1)</li>
 * </ul>
 *
 * <p>최악의 경우 한 번의 백엔드 호출은 (maxRetries + 1)회 시도되며,
 * 대기 시간 합은 대략 maxRetries * maxDelayMs 이하입니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
 * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
 * @param maxRetries 최대 재시도 횟수 (0 이상, 0이면 재시도 안 함)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 */
public record RetryPolicy(
    long baseDelayMs,
    long maxDelayMs,
    int maxRetries,
    double jitterFactor
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: baseDelayMs=200ms, maxDelayMs=5000ms, maxRetries=5, jitterFactor=0.1</p>
     */
    public RetryPolicy() {
        this(200, 5000, 5, 0.1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries must be non-negative (current: " + maxRetries + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    /**
     * 재시도하지 않는 정책.
     */
    public static RetryPolicy none() {
        return new RetryPolicy(1, 1, 0, 0.0);
    }

    /**
     * 이 정책의 백오프 계산기 생성.
     *
     * @return BackoffCalculator
     */
    public BackoffCalculator toBackoffCalculator() {
        return new BackoffCalculator(baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * baseDelayMs만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withBaseDelayMs(long baseDelayMs) {
        return new RetryPolicy(baseDelayMs, maxDelayMs, maxRetries, jitterFactor);
    }

    /**
     * maxDelayMs만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxDelayMs(long maxDelayMs) {
        return new RetryPolicy(baseDelayMs, maxDelayMs, maxRetries, jitterFactor);
    }

    /**
     * maxRetries만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxRetries(int maxRetries) {
        return new RetryPolicy(baseDelayMs, maxDelayMs, maxRetries, jitterFactor);
    }

    /**
     * jitterFactor만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withJitterFactor(double jitterFactor) {
        return new RetryPolicy(baseDelayMs, maxDelayMs, maxRetries, jitterFactor);
    }
}
