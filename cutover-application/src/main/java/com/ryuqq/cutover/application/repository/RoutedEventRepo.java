package com.ryuqq.cutover.application.repository;

import com.ryuqq.cutover.application.document.DateIndexEntry;
import com.ryuqq.cutover.application.document.DocumentCodec;
import com.ryuqq.cutover.application.document.EventSummary;
import com.ryuqq.cutover.application.document.Hunt;
import com.ryuqq.cutover.application.document.Organization;
import com.ryuqq.cutover.application.fallback.ReadThroughFallback;
import com.ryuqq.cutover.application.fallback.ServedRecord;
import com.ryuqq.cutover.application.routing.ReadRoute;
import com.ryuqq.cutover.core.model.CorrelationId;
import com.ryuqq.cutover.core.model.KeyPrefix;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.model.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * DateIndex 파티션과 조직 문서를 합쳐 이벤트 목록을 만드는 {@link EventRepo} 구현체.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class RoutedEventRepo implements EventRepo {

    private static final Logger log = LoggerFactory.getLogger(RoutedEventRepo.class);

    private static final Comparator<EventSummary> ORDER = Comparator
        .comparing(EventSummary::orgName, Comparator.nullsLast(Comparator.<String>naturalOrder()))
        .thenComparing(EventSummary::eventName, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final Supplier<ReadRoute> readRoute;
    private final ReadThroughFallback fallback;
    private final DocumentCodec<DateIndexEntry> indexCodec;
    private final DocumentCodec<Organization> orgCodec;

    public RoutedEventRepo(
        Supplier<ReadRoute> readRoute,
        ReadThroughFallback fallback,
        DocumentCodec<DateIndexEntry> indexCodec,
        DocumentCodec<Organization> orgCodec
    ) {
        if (readRoute == null) {
            throw new IllegalArgumentException("readRoute cannot be null");
        }
        if (fallback == null) {
            throw new IllegalArgumentException("fallback cannot be null");
        }
        if (indexCodec == null) {
            throw new IllegalArgumentException("indexCodec cannot be null");
        }
        if (orgCodec == null) {
            throw new IllegalArgumentException("orgCodec cannot be null");
        }
        this.readRoute = readRoute;
        this.fallback = fallback;
        this.indexCodec = indexCodec;
        this.orgCodec = orgCodec;
    }

    @Override
    public List<EventSummary> listForDate(LocalDate date, CorrelationId correlationId) {
        if (date == null) {
            throw new IllegalArgumentException("date cannot be null");
        }
        ReadRoute route = readRoute.get();

        // 1. 날짜 파티션 조회
        List<ServedRecord> entries = fallback.queryPartition(
            route, KeyPrefix.partition(Table.DATE_INDEX, date.toString()), correlationId);

        // 2. 항목별 조직 문서와 결합 (조직당 한 번만 읽음)
        Map<String, Optional<Organization>> organizations = new HashMap<>();
        List<EventSummary> events = new ArrayList<>();
        for (ServedRecord served : entries) {
            DateIndexEntry entry = indexCodec.decode(served.record().key(), served.record().payload());
            Optional<Organization> organization = organizations.computeIfAbsent(
                entry.orgSlug(), slug -> loadOrganization(route, slug, correlationId));
            Optional<Hunt> hunt = organization.flatMap(org -> org.findHunt(entry.huntId()));
            if (hunt.isEmpty()) {
                log.warn("Date index entry {} points to missing hunt {}/{}, skipping",
                    served.record().key(), entry.orgSlug(), entry.huntId());
                continue;
            }
            events.add(EventSummary.of(organization.get(), hunt.get()));
        }

        // 3. 조직 이름, 이벤트 이름 순 정렬
        events.sort(ORDER);
        return events;
    }

    private Optional<Organization> loadOrganization(ReadRoute route, String orgSlug, CorrelationId correlationId) {
        RecordKey key = RecordKey.organization(orgSlug);
        return fallback.read(route, key, correlationId)
            .map(served -> orgCodec.decode(key, served.record().payload()));
    }
}
