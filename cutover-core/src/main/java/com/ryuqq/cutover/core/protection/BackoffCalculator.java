package com.ryuqq.cutover.core.protection;

import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 지수적으로 증가시키되, Jitter를 추가하여
 * 여러 호출자가 동시에 재시도하며 백엔드를 다시 포화시키는 것을 막습니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(attempt-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=200ms, maxDelay=5000ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attempt=1: 200ms + jitter(0-20ms)</li>
 *   <li>attempt=2: 400ms + jitter(0-40ms)</li>
 *   <li>attempt=5: 3200ms + jitter(0-320ms)</li>
 *   <li>attempt=6: 6400ms → 5000ms (maxDelay)</li>
 * </ul>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=200ms, maxDelay=5000ms, jitterFactor=0.1</p>
     */
    public BackoffCalculator() {
        this(200, 5000, 0.1);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, Math::random);
    }

    /**
     * 난수 공급자를 지정하여 생성 (테스트용).
     *
     * @param random [0.0, 1.0) 범위 난수 공급자
     */
    BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
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
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attempt 재시도 순번 (1부터 시작)
     * @return 재시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public long calculate(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException(
                "attempt must be positive (current: " + attempt + ")"
            );
        }

        // shift는 62에서 멈춰 overflow를 막는다
        int shift = Math.min(attempt - 1, 62);
        long multiplier = 1L << shift;
        long exponential = multiplier > maxDelayMs / baseDelayMs
            ? maxDelayMs
            : Math.min(baseDelayMs * multiplier, maxDelayMs);

        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());

        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
