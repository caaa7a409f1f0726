package com.ryuqq.cutover.application.repository;

import com.ryuqq.cutover.application.routing.StoreRole;
import com.ryuqq.cutover.core.model.VersionToken;

/**
 * 문서와 그 문서를 읽은 시점의 버전 토큰.
 *
 * <p>호출자는 {@code version}을 고정 버전 upsert에 그대로 제시합니다.</p>
 *
 * @param document 문서
 * @param version 서비스한 저장소의 토큰
 * @param servedBy 서비스한 저장소
 * @param <T> 문서 타입
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public record Versioned<T>(
    T document,
    VersionToken version,
    StoreRole servedBy
) {

    public Versioned {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        if (version == null) {
            throw new IllegalArgumentException("version cannot be null");
        }
        if (servedBy == null) {
            throw new IllegalArgumentException("servedBy cannot be null");
        }
    }
}
