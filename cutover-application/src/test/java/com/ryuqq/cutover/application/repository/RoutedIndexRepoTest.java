package com.ryuqq.cutover.application.repository;

import com.ryuqq.cutover.adapter.inmemory.store.InMemoryStoreAdapter;
import com.ryuqq.cutover.application.config.FlagsSource;
import com.ryuqq.cutover.application.config.StoreFlags;
import com.ryuqq.cutover.application.document.DateIndexEntry;
import com.ryuqq.cutover.application.document.Hunt;
import com.ryuqq.cutover.application.routing.RepositoryFactory;
import com.ryuqq.cutover.application.routing.RepositoryOptions;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.outcome.Outcome;
import com.ryuqq.cutover.core.outcome.Unavailable;
import com.ryuqq.cutover.core.spi.RecordValidationException;
import com.ryuqq.cutover.core.spi.StoreUnavailableException;
import com.ryuqq.cutover.testkit.store.RecordingStoreAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RoutedIndexRepo 테스트.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
class RoutedIndexRepoTest {

    private static final LocalDate MAY_FIRST = LocalDate.of(2024, 5, 1);
    private static final StoreFlags DUAL = new StoreFlags(true, true, false, false);

    private final InMemoryStoreAdapter primary = new InMemoryStoreAdapter("primary");
    private final InMemoryStoreAdapter legacy = new InMemoryStoreAdapter("legacy");

    private RepositoryFactory factory;

    @BeforeEach
    void setUp() {
        factory = new RepositoryFactory(primary, legacy, DUAL,
            FlagsSource.fixed(DUAL), RepositoryOptions.defaults(Runnable::run));
    }

    @Test
    void hunt의_이름과_상태로_인덱스_항목을_쓴다() {
        // given
        factory.orgRepo().upsert("acme", org -> org.withHunt(Hunt.scheduled("spring", "Spring Hunt", MAY_FIRST)));

        // when
        Outcome<DateIndexEntry> outcome = factory.indexRepo().upsertDateEntry(MAY_FIRST, "acme", "spring");

        // then
        assertThat(outcome.isOk()).isTrue();
        DateIndexEntry entry = outcome.value();
        assertThat(entry.date()).isEqualTo("2024-05-01");
        assertThat(entry.huntName()).isEqualTo("Spring Hunt");
        assertThat(entry.status()).isEqualTo(Hunt.STATUS_SCHEDULED);
        assertThat(primary.size()).isEqualTo(2);
        assertThat(legacy.size()).isEqualTo(2);
    }

    @Test
    void hunt가_바뀌면_인덱스_항목을_갱신한다() {
        // given
        Hunt spring = Hunt.scheduled("spring", "Spring Hunt", MAY_FIRST);
        factory.orgRepo().upsert("acme", org -> org.withHunt(spring));
        factory.indexRepo().upsertDateEntry(MAY_FIRST, "acme", "spring");
        factory.orgRepo().upsert("acme", org -> org.withHunt(spring.withStatus("live")));

        // when
        Outcome<DateIndexEntry> outcome = factory.indexRepo().upsertDateEntry(MAY_FIRST, "acme", "spring");

        // then
        assertThat(outcome.value().status()).isEqualTo("live");
    }

    @Test
    void 없는_hunt는_검증_예외다() {
        // given
        factory.orgRepo().upsert("acme", org -> org);

        // when & then
        assertThatThrownBy(() -> factory.indexRepo().upsertDateEntry(MAY_FIRST, "acme", "missing"))
            .isInstanceOf(RecordValidationException.class)
            .hasMessageContaining("acme/missing");
        assertThat(primary.size()).isEqualTo(1);
    }

    @Test
    void 없는_조직은_검증_예외다() {
        assertThatThrownBy(() -> factory.indexRepo().upsertDateEntry(MAY_FIRST, "nobody", "spring"))
            .isInstanceOf(RecordValidationException.class)
            .hasMessageContaining("nobody");
    }

    @Test
    void 조직을_읽을_저장소가_응답하지_않으면_Unavailable이다() {
        // given
        factory.orgRepo().upsert("acme", org -> org.withHunt(Hunt.scheduled("spring", "Spring Hunt", MAY_FIRST)));
        RecordingStoreAdapter failingLegacy = new RecordingStoreAdapter(legacy);
        failingLegacy.failGets(key -> new StoreUnavailableException("legacy", "down"));
        RepositoryFactory failing = new RepositoryFactory(primary, failingLegacy, DUAL,
            FlagsSource.fixed(DUAL), RepositoryOptions.defaults(Runnable::run));

        // when
        Outcome<DateIndexEntry> outcome = failing.indexRepo().upsertDateEntry(MAY_FIRST, "acme", "spring");

        // then
        assertThat(outcome).isInstanceOf(Unavailable.class);
        Unavailable<DateIndexEntry> unavailable = (Unavailable<DateIndexEntry>) outcome;
        assertThat(unavailable.key()).isEqualTo(RecordKey.organization("acme"));
        assertThat(unavailable.backend()).isEqualTo("legacy");
        assertThat(failingLegacy.putCount()).isZero();
        assertThat(primary.size()).isEqualTo(1);
    }
}
