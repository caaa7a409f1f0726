package com.ryuqq.cutover.application.routing;

/**
 * 읽기 경로.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public enum ReadRoute {

    /**
     * Legacy만 조회 (전환 시작 전).
     */
    LEGACY_ONLY,

    /**
     * Primary 우선, NotFound/Unavailable 시 Legacy (Read-Through Fallback).
     */
    PRIMARY_WITH_FALLBACK
}
