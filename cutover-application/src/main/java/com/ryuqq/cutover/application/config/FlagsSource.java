package com.ryuqq.cutover.application.config;

/**
 * 플래그 스냅샷 공급원.
 *
 * <p>Repository Factory의 reload가 호출될 때마다 새 스냅샷을 가져옵니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FlagsSource {

    /**
     * 현재 플래그 읽기.
     *
     * @return 최신 스냅샷
     * @throws IllegalArgumentException 설정값이 잘못된 경우
     */
    StoreFlags load();

    /**
     * 항상 같은 스냅샷을 반환하는 공급원.
     */
    static FlagsSource fixed(StoreFlags flags) {
        if (flags == null) {
            throw new IllegalArgumentException("flags cannot be null");
        }
        return () -> flags;
    }
}
