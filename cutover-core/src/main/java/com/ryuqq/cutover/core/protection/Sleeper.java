package com.ryuqq.cutover.core.protection;

/**
 * 재시도 대기 추상화.
 *
 * <p>테스트에서는 실제로 잠들지 않고 요청된 대기 시간만 기록하는 구현을 주입합니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 현재 스레드를 주어진 시간 동안 대기.
     *
     * @param millis 대기 시간 (밀리초)
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    void sleep(long millis) throws InterruptedException;

    /**
     * {@link Thread#sleep(long)} 기반 기본 구현.
     */
    static Sleeper threadSleep() {
        return Thread::sleep;
    }
}
