package com.ryuqq.cutover.application.repository;

import com.ryuqq.cutover.application.coordinator.DualWriteCoordinator;
import com.ryuqq.cutover.application.document.DocumentCodec;
import com.ryuqq.cutover.application.document.Organization;
import com.ryuqq.cutover.application.fallback.ReadThroughFallback;
import com.ryuqq.cutover.application.routing.Routes;
import com.ryuqq.cutover.core.model.CorrelationId;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.model.VersionToken;
import com.ryuqq.cutover.core.outcome.Outcome;

import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * 플래그 경로를 따르는 {@link OrgRepo} 구현체.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class RoutedOrgRepo implements OrgRepo {

    private final Supplier<Routes> routes;
    private final ReadThroughFallback fallback;
    private final DualWriteCoordinator coordinator;
    private final DocumentCodec<Organization> codec;

    public RoutedOrgRepo(
        Supplier<Routes> routes,
        ReadThroughFallback fallback,
        DualWriteCoordinator coordinator,
        DocumentCodec<Organization> codec
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
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.routes = routes;
        this.fallback = fallback;
        this.coordinator = coordinator;
        this.codec = codec;
    }

    @Override
    public Optional<Organization> get(String orgSlug, CorrelationId correlationId) {
        return getVersioned(orgSlug, correlationId).map(Versioned::document);
    }

    @Override
    public Optional<Versioned<Organization>> getVersioned(String orgSlug, CorrelationId correlationId) {
        RecordKey key = keyOf(orgSlug);
        return fallback.read(routes.get().read(), key, correlationId)
            .map(served -> new Versioned<>(
                codec.decode(key, served.record().payload()),
                served.record().version(),
                served.servedBy()
            ));
    }

    @Override
    public Outcome<Organization> upsert(
        String orgSlug,
        UnaryOperator<Organization> mutator,
        CorrelationId correlationId
    ) {
        return coordinator.write(routes.get(), keyOf(orgSlug), codec, mutator, correlationId);
    }

    @Override
    public Outcome<Organization> upsert(
        String orgSlug,
        VersionToken expectedVersion,
        UnaryOperator<Organization> mutator,
        CorrelationId correlationId
    ) {
        return coordinator.writePinned(routes.get(), keyOf(orgSlug), codec, expectedVersion, mutator, correlationId);
    }

    private static RecordKey keyOf(String orgSlug) {
        if (orgSlug == null || orgSlug.isBlank()) {
            throw new IllegalArgumentException("orgSlug cannot be null or blank");
        }
        return RecordKey.organization(orgSlug);
    }
}
