package com.ryuqq.cutover.application.repository;

import com.ryuqq.cutover.application.document.Organization;
import com.ryuqq.cutover.core.model.CorrelationId;
import com.ryuqq.cutover.core.model.VersionToken;
import com.ryuqq.cutover.core.outcome.Outcome;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Organization Repository Port.
 *
 * <p>어느 저장소가 호출을 처리하는지는 호출 시점의 플래그 스냅샷이 결정하며, 호출자에게
 * 드러나지 않습니다. correlationId를 받지 않는 메서드는 새 ID를 발급합니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public interface OrgRepo {

    /**
     * 조직 문서 조회.
     *
     * @param orgSlug 조직 slug
     * @param correlationId 상관관계 ID
     * @return 문서 (없으면 empty)
     * @throws com.ryuqq.cutover.core.spi.StoreUnavailableException 저장소가 응답하지 않는 경우
     */
    Optional<Organization> get(String orgSlug, CorrelationId correlationId);

    default Optional<Organization> get(String orgSlug) {
        return get(orgSlug, CorrelationId.newId());
    }

    /**
     * 조직 문서와 버전 토큰 조회.
     */
    Optional<Versioned<Organization>> getVersioned(String orgSlug, CorrelationId correlationId);

    default Optional<Versioned<Organization>> getVersioned(String orgSlug) {
        return getVersioned(orgSlug, CorrelationId.newId());
    }

    /**
     * read-modify-write (충돌 시 한 번 재시도).
     *
     * @param orgSlug 조직 slug
     * @param mutator 현재 문서(없으면 빈 문서)를 받아 새 문서를 반환
     * @param correlationId 상관관계 ID
     * @return Ok | Conflict | Unavailable
     */
    Outcome<Organization> upsert(String orgSlug, UnaryOperator<Organization> mutator, CorrelationId correlationId);

    default Outcome<Organization> upsert(String orgSlug, UnaryOperator<Organization> mutator) {
        return upsert(orgSlug, mutator, CorrelationId.newId());
    }

    /**
     * 호출자가 읽은 버전을 고정한 read-modify-write.
     *
     * <p>현재 버전이 {@code expectedVersion}과 다르면 재시도 없이 Conflict를 반환합니다.</p>
     */
    Outcome<Organization> upsert(
        String orgSlug,
        VersionToken expectedVersion,
        UnaryOperator<Organization> mutator,
        CorrelationId correlationId
    );

    default Outcome<Organization> upsert(
        String orgSlug,
        VersionToken expectedVersion,
        UnaryOperator<Organization> mutator
    ) {
        return upsert(orgSlug, expectedVersion, mutator, CorrelationId.newId());
    }
}
