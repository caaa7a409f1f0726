package com.ryuqq.cutover.application.repository;

import com.ryuqq.cutover.application.coordinator.DualWriteCoordinator;
import com.ryuqq.cutover.application.document.DateIndexEntry;
import com.ryuqq.cutover.application.document.DocumentCodec;
import com.ryuqq.cutover.application.document.Hunt;
import com.ryuqq.cutover.application.document.Organization;
import com.ryuqq.cutover.application.fallback.ReadThroughFallback;
import com.ryuqq.cutover.application.fallback.ServedRecord;
import com.ryuqq.cutover.application.routing.Routes;
import com.ryuqq.cutover.core.model.CorrelationId;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.outcome.Outcome;
import com.ryuqq.cutover.core.outcome.Unavailable;
import com.ryuqq.cutover.core.spi.RecordValidationException;
import com.ryuqq.cutover.core.spi.StoreUnavailableException;

import java.time.LocalDate;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 조직 문서의 hunt를 기준으로 DateIndex를 쓰는 {@link IndexRepo} 구현체.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class RoutedIndexRepo implements IndexRepo {

    private final Supplier<Routes> routes;
    private final ReadThroughFallback fallback;
    private final DualWriteCoordinator coordinator;
    private final DocumentCodec<DateIndexEntry> indexCodec;
    private final DocumentCodec<Organization> orgCodec;

    public RoutedIndexRepo(
        Supplier<Routes> routes,
        ReadThroughFallback fallback,
        DualWriteCoordinator coordinator,
        DocumentCodec<DateIndexEntry> indexCodec,
        DocumentCodec<Organization> orgCodec
    ) {
        if (routes == null) {
            throw new IllegalArgumentException("routes cannot be null");
        }
        if (fallback == null) {
            throw new IllegalArgumentException("fallback cannot be null");
        }
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        if (indexCodec == null) {
            throw new IllegalArgumentException("indexCodec cannot be null");
        }
        if (orgCodec == null) {
            throw new IllegalArgumentException("orgCodec cannot be null");
        }
        this.routes = routes;
        this.fallback = fallback;
        this.coordinator = coordinator;
        this.indexCodec = indexCodec;
        this.orgCodec = orgCodec;
    }

    @Override
    public Outcome<DateIndexEntry> upsertDateEntry(
        LocalDate date,
        String orgSlug,
        String huntId,
        CorrelationId correlationId
    ) {
        if (date == null) {
            throw new IllegalArgumentException("date cannot be null");
        }
        if (orgSlug == null || orgSlug.isBlank()) {
            throw new IllegalArgumentException("orgSlug cannot be null or blank");
        }
        if (huntId == null || huntId.isBlank()) {
            throw new IllegalArgumentException("huntId cannot be null or blank");
        }
        Routes snapshot = routes.get();

        // 1. hunt 존재 확인
        RecordKey orgKey = RecordKey.organization(orgSlug);
        Optional<ServedRecord> served;
        try {
            served = fallback.read(snapshot.read(), orgKey, correlationId);
        } catch (StoreUnavailableException e) {
            return new Unavailable<>(orgKey, e.getBackend(), e.getMessage());
        }
        Organization organization = served
            .map(record -> orgCodec.decode(orgKey, record.record().payload()))
            .orElseThrow(() -> new RecordValidationException("Organization not found: " + orgSlug));
        Hunt hunt = organization.findHunt(huntId)
            .orElseThrow(() -> new RecordValidationException(
                "Hunt not found: " + orgSlug + "/" + huntId));

        // 2. 인덱스 항목 쓰기
        return coordinator.write(
            snapshot,
            RecordKey.dateIndex(date, orgSlug, huntId),
            indexCodec,
            current -> current.refreshedFrom(hunt),
            correlationId
        );
    }
}
