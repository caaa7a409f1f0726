package com.ryuqq.cutover.application.routing;

/**
 * 전환 과정에서 저장소가 맡는 역할.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public enum StoreRole {

    /**
     * 전환 대상 저장소.
     */
    PRIMARY,

    /**
     * 퇴역 예정 저장소.
     */
    LEGACY
}
