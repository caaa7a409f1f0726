package com.ryuqq.cutover.application.config;

import com.ryuqq.cutover.application.routing.RepositoryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 플래그 주기적 재로딩.
 *
 * <p>고정 간격으로 {@link RepositoryFactory#reload()}를 호출합니다. 재로딩 실패
 * (잘못된 설정값 등)는 로그로 남기고 이전 스냅샷을 유지합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (FlagRefresher refresher = new FlagRefresher(factory, 30_000)) {
 *     refresher.start();
 *     // ... 서비스 실행 ...
 * }
 * </pre>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class FlagRefresher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FlagRefresher.class);

    private final RepositoryFactory factory;
    private final long intervalMs;
    private final ScheduledExecutorService scheduler;

    /**
     * 생성자.
     *
     * @param factory 재로딩 대상
     * @param intervalMs 폴링 간격 (밀리초, 양수여야 함)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public FlagRefresher(RepositoryFactory factory, long intervalMs) {
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (intervalMs <= 0) {
            throw new IllegalArgumentException(
                "intervalMs must be positive (current: " + intervalMs + ")"
            );
        }
        this.factory = factory;
        this.intervalMs = intervalMs;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "cutover-flag-refresher");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 폴링 시작.
     */
    public void start() {
        scheduler.scheduleWithFixedDelay(this::refresh, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("FlagRefresher started: intervalMs={}", intervalMs);
    }

    /**
     * 한 번 재로딩 (스케줄러 스레드에서 호출됨).
     */
    void refresh() {
        try {
            factory.reload();
        } catch (RuntimeException e) {
            log.error("Flag reload failed, keeping previous snapshot {}", factory.currentFlags(), e);
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        log.info("FlagRefresher stopped");
    }
}
