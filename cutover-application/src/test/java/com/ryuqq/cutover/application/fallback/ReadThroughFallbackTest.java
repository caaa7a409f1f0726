package com.ryuqq.cutover.application.fallback;

import com.ryuqq.cutover.adapter.inmemory.store.InMemoryStoreAdapter;
import com.ryuqq.cutover.application.routing.ReadRoute;
import com.ryuqq.cutover.application.routing.StoreRole;
import com.ryuqq.cutover.core.model.CorrelationId;
import com.ryuqq.cutover.core.model.ExpectedVersion;
import com.ryuqq.cutover.core.model.KeyPrefix;
import com.ryuqq.cutover.core.model.Payload;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.model.Table;
import com.ryuqq.cutover.core.spi.StoreUnavailableException;
import com.ryuqq.cutover.testkit.store.RecordingStoreAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ReadThroughFallback 테스트.
 *
 * <p>backfill Executor는 작업을 모아두었다가 테스트가 직접 실행합니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
class ReadThroughFallbackTest {

    private static final RecordKey ACME = RecordKey.organization("acme");
    private static final Payload ACME_PAYLOAD = Payload.of("{\"org\":{\"orgSlug\":\"acme\",\"orgName\":\"Acme\"}}");

    private final CorrelationId cid = CorrelationId.of("fallback-test");
    private final List<Runnable> scheduled = new ArrayList<>();

    private RecordingStoreAdapter primary;
    private RecordingStoreAdapter legacy;
    private ReadThroughFallback fallback;

    @BeforeEach
    void setUp() {
        primary = new RecordingStoreAdapter(new InMemoryStoreAdapter("primary"));
        legacy = new RecordingStoreAdapter(new InMemoryStoreAdapter("legacy"));
        fallback = new ReadThroughFallback(primary, legacy, scheduled::add);
    }

    private void runScheduled() {
        List<Runnable> tasks = new ArrayList<>(scheduled);
        scheduled.clear();
        tasks.forEach(Runnable::run);
    }

    // ============================================================
    // read
    // ============================================================

    @Test
    void legacy에만_있으면_legacy_레코드를_반환하고_backfill을_한번_예약한다() {
        // given
        legacy.getDelegate().put(ACME, ACME_PAYLOAD, ExpectedVersion.any(), cid);

        // when
        Optional<ServedRecord> result = fallback.read(ReadRoute.PRIMARY_WITH_FALLBACK, ACME, cid);

        // then
        assertThat(result).isPresent();
        assertThat(result.get().servedBy()).isEqualTo(StoreRole.LEGACY);
        assertThat(result.get().record().payload()).isEqualTo(ACME_PAYLOAD);
        assertThat(scheduled).hasSize(1);

        runScheduled();
        assertThat(primary.putCount()).isEqualTo(1);
        assertThat(primary.putConditions()).containsExactly(ExpectedVersion.absent());
        assertThat(primary.getDelegate().get(ACME, cid).orElseThrow().payload()).isEqualTo(ACME_PAYLOAD);
    }

    @Test
    void backfill후에는_primary에서_서비스한다() {
        // given
        legacy.getDelegate().put(ACME, ACME_PAYLOAD, ExpectedVersion.any(), cid);
        fallback.read(ReadRoute.PRIMARY_WITH_FALLBACK, ACME, cid);
        runScheduled();

        // when
        Optional<ServedRecord> result = fallback.read(ReadRoute.PRIMARY_WITH_FALLBACK, ACME, cid);

        // then
        assertThat(result.orElseThrow().servedBy()).isEqualTo(StoreRole.PRIMARY);
        assertThat(scheduled).isEmpty();
    }

    @Test
    void primary가_장애면_legacy를_읽고_backfill하지_않는다() {
        // given
        legacy.getDelegate().put(ACME, ACME_PAYLOAD, ExpectedVersion.any(), cid);
        primary.failGets(key -> new StoreUnavailableException("primary", "down"));

        // when
        Optional<ServedRecord> result = fallback.read(ReadRoute.PRIMARY_WITH_FALLBACK, ACME, cid);

        // then
        assertThat(result.orElseThrow().servedBy()).isEqualTo(StoreRole.LEGACY);
        assertThat(scheduled).isEmpty();
    }

    @Test
    void 두_저장소가_모두_장애면_예외를_던진다() {
        // given
        primary.failGets(key -> new StoreUnavailableException("primary", "down"));
        legacy.failGets(key -> new StoreUnavailableException("legacy", "down"));

        // when & then
        assertThatThrownBy(() -> fallback.read(ReadRoute.PRIMARY_WITH_FALLBACK, ACME, cid))
            .isInstanceOf(StoreUnavailableException.class)
            .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
    }

    @Test
    void legacy_전용_경로는_primary를_조회하지_않는다() {
        // given
        legacy.getDelegate().put(ACME, ACME_PAYLOAD, ExpectedVersion.any(), cid);

        // when
        Optional<ServedRecord> result = fallback.read(ReadRoute.LEGACY_ONLY, ACME, cid);

        // then
        assertThat(result).isPresent();
        assertThat(primary.getCount()).isZero();
        assertThat(scheduled).isEmpty();
    }

    @Test
    void 어디에도_없으면_empty다() {
        assertThat(fallback.read(ReadRoute.PRIMARY_WITH_FALLBACK, ACME, cid)).isEmpty();
        assertThat(scheduled).isEmpty();
    }

    // ============================================================
    // backfill
    // ============================================================

    @Test
    void backfill은_이미_생성된_primary_레코드를_덮어쓰지_않는다() {
        // given
        legacy.getDelegate().put(ACME, ACME_PAYLOAD, ExpectedVersion.any(), cid);
        fallback.read(ReadRoute.PRIMARY_WITH_FALLBACK, ACME, cid);
        Payload newer = Payload.of("{\"org\":{\"orgSlug\":\"acme\",\"orgName\":\"Acme Inc\"}}");
        primary.getDelegate().put(ACME, newer, ExpectedVersion.absent(), cid);

        // when
        runScheduled();

        // then
        assertThat(primary.getDelegate().get(ACME, cid).orElseThrow().payload()).isEqualTo(newer);
    }

    @Test
    void backfill은_장애시_한번만_재시도한다() {
        // given
        legacy.getDelegate().put(ACME, ACME_PAYLOAD, ExpectedVersion.any(), cid);
        fallback.read(ReadRoute.PRIMARY_WITH_FALLBACK, ACME, cid);
        primary.failPuts(key -> new StoreUnavailableException("primary", "down"));

        // when
        runScheduled();

        // then
        assertThat(primary.putCount()).isEqualTo(2);
        assertThat(primary.getDelegate().get(ACME, cid)).isEmpty();
    }

    @Test
    void executor가_거부해도_읽기는_성공한다() {
        // given
        legacy.getDelegate().put(ACME, ACME_PAYLOAD, ExpectedVersion.any(), cid);
        ReadThroughFallback rejecting = new ReadThroughFallback(primary, legacy, task -> {
            throw new RejectedExecutionException("queue full");
        });

        // when
        Optional<ServedRecord> result = rejecting.read(ReadRoute.PRIMARY_WITH_FALLBACK, ACME, cid);

        // then
        assertThat(result).isPresent();
    }

    // ============================================================
    // queryPartition
    // ============================================================

    @Test
    void primary_파티션이_비어있으면_legacy_파티션을_반환한다() {
        // given
        LocalDate date = LocalDate.of(2024, 5, 1);
        RecordKey entry = RecordKey.dateIndex(date, "acme", "spring");
        legacy.getDelegate().put(entry, Payload.of("{}"), ExpectedVersion.any(), cid);

        // when
        List<ServedRecord> result = fallback.queryPartition(
            ReadRoute.PRIMARY_WITH_FALLBACK, KeyPrefix.partition(Table.DATE_INDEX, date.toString()), cid);

        // then
        assertThat(result).extracting(ServedRecord::servedBy).containsExactly(StoreRole.LEGACY);
        assertThat(scheduled).hasSize(1);
    }

    @Test
    void primary와_legacy_파티션을_키_단위로_병합하고_primary가_우선한다() {
        // given
        LocalDate date = LocalDate.of(2024, 5, 1);
        RecordKey acme = RecordKey.dateIndex(date, "acme", "spring");
        RecordKey globex = RecordKey.dateIndex(date, "globex", "launch");
        primary.getDelegate().put(acme, Payload.of("{\"status\":\"live\"}"), ExpectedVersion.any(), cid);
        legacy.getDelegate().put(acme, Payload.of("{\"status\":\"scheduled\"}"), ExpectedVersion.any(), cid);
        legacy.getDelegate().put(globex, Payload.of("{}"), ExpectedVersion.any(), cid);

        // when
        List<ServedRecord> result = fallback.queryPartition(
            ReadRoute.PRIMARY_WITH_FALLBACK, KeyPrefix.partition(Table.DATE_INDEX, date.toString()), cid);

        // then
        assertThat(result).extracting(served -> served.record().key()).containsExactly(acme, globex);
        assertThat(result).extracting(ServedRecord::servedBy).containsExactly(StoreRole.PRIMARY, StoreRole.LEGACY);
        assertThat(result.get(0).record().payload()).isEqualTo(Payload.of("{\"status\":\"live\"}"));
        assertThat(scheduled).hasSize(1);

        runScheduled();
        assertThat(primary.putKeys()).containsExactly(globex);
    }

    @Test
    void legacy가_장애면_primary_파티션만_반환한다() {
        // given
        LocalDate date = LocalDate.of(2024, 5, 1);
        primary.getDelegate().put(RecordKey.dateIndex(date, "acme", "spring"), Payload.of("{}"), ExpectedVersion.any(), cid);
        legacy.failQueries(prefix -> new StoreUnavailableException("legacy", "down"));

        // when
        List<ServedRecord> result = fallback.queryPartition(
            ReadRoute.PRIMARY_WITH_FALLBACK, KeyPrefix.partition(Table.DATE_INDEX, date.toString()), cid);

        // then
        assertThat(result).extracting(ServedRecord::servedBy).containsExactly(StoreRole.PRIMARY);
        assertThat(scheduled).isEmpty();
    }

    @Test
    void 두_저장소_파티션이_모두_장애면_예외를_던진다() {
        // given
        primary.failQueries(prefix -> new StoreUnavailableException("primary", "down"));
        legacy.failQueries(prefix -> new StoreUnavailableException("legacy", "down"));

        // when & then
        assertThatThrownBy(() -> fallback.queryPartition(
            ReadRoute.PRIMARY_WITH_FALLBACK, KeyPrefix.partition(Table.DATE_INDEX, "2024-05-01"), cid))
            .isInstanceOf(StoreUnavailableException.class)
            .hasMessageContaining("down");
    }
}
