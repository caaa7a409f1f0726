package com.ryuqq.cutover.application.routing;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Repository Factory 동작 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>writeOrder: 이중 쓰기 순서 (기본 PRIMARY_FIRST)</li>
 *   <li>backfillExecutor: 기회적 backfill을 실행할 Executor </li>
 *   <li>clock: 문서 updatedAt 시각 (기본 UTC system clock)</li>
 * </ul>
 *
 * @author Cutover Team
 * @since 1.0.0
 * @param writeOrder 이중 쓰기 순서
 * @param backfillExecutor backfill Executor
 * @param clock 문서 시각
 */
public record RepositoryOptions(
    WriteOrder writeOrder,
    Executor backfillExecutor,
    Clock clock
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public RepositoryOptions {
        if (writeOrder == null) {
            throw new IllegalArgumentException("writeOrder cannot be null");
        }
        if (backfillExecutor == null) {
            throw new IllegalArgumentException("backfillExecutor cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
    }

    /**
     * 기본 설정.
     *
     * @param backfillExecutor backfill Executor (수명은 호출자가 관리)
     */
    public static RepositoryOptions defaults(Executor backfillExecutor) {
        return new RepositoryOptions(WriteOrder.PRIMARY_FIRST, backfillExecutor, Clock.systemUTC());
    }

    /**
     * writeOrder만 변경한 새 인스턴스 생성.
     */
    public RepositoryOptions withWriteOrder(WriteOrder writeOrder) {
        return new RepositoryOptions(writeOrder, backfillExecutor, clock);
    }

    /**
     * backfillExecutor만 변경한 새 인스턴스 생성.
     */
    public RepositoryOptions withBackfillExecutor(Executor backfillExecutor) {
        return new RepositoryOptions(writeOrder, backfillExecutor, clock);
    }

    /**
     * clock만 변경한 새 인스턴스 생성.
     */
    public RepositoryOptions withClock(Clock clock) {
        return new RepositoryOptions(writeOrder, backfillExecutor, clock);
    }
}
