package com.ryuqq.cutover.application.routing;

import java.util.List;

/**
 * 쓰기 경로.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public enum WriteRoute {

    /**
     * Legacy에만 쓰기.
     */
    LEGACY_ONLY,

    /**
     * Primary에만 쓰기 (이중 쓰기 종료 후).
     */
    PRIMARY_ONLY,

    /**
     * 두 저장소에 순차적으로 쓰기 (Dual-Write Coordinator).
     */
    DUAL;

    /**
     * 쓰기 대상을 실행 순서대로 반환.
     *
     * @param order 이중 쓰기 순서
     * @return 첫 번째 대상부터 나열된 역할 목록
     */
    public List<StoreRole> targets(WriteOrder order) {
        switch (this) {
            case LEGACY_ONLY:
                return List.of(StoreRole.LEGACY);
            case PRIMARY_ONLY:
                return List.of(StoreRole.PRIMARY);
            default:
                return order == WriteOrder.LEGACY_FIRST
                    ? List.of(StoreRole.LEGACY, StoreRole.PRIMARY)
                    : List.of(StoreRole.PRIMARY, StoreRole.LEGACY);
        }
    }
}
