package com.ryuqq.cutover.application.routing;

/**
 * 이중 쓰기 순서.
 *
 * <p>첫 번째 대상이 실패하면 두 번째 대상은 호출되지 않습니다. 기본값은
 * {@link #PRIMARY_FIRST}로, Legacy가 Primary보다 앞서 나가는 상황을 막습니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public enum WriteOrder {

    PRIMARY_FIRST,

    LEGACY_FIRST
}
