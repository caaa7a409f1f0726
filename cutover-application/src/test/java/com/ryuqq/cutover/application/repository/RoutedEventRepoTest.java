package com.ryuqq.cutover.application.repository;

import com.ryuqq.cutover.adapter.inmemory.store.InMemoryStoreAdapter;
import com.ryuqq.cutover.application.config.FlagsSource;
import com.ryuqq.cutover.application.config.StoreFlags;
import com.ryuqq.cutover.application.document.EventSummary;
import com.ryuqq.cutover.application.document.Hunt;
import com.ryuqq.cutover.application.document.OrgProfile;
import com.ryuqq.cutover.application.document.Organization;
import com.ryuqq.cutover.application.routing.RepositoryFactory;
import com.ryuqq.cutover.application.routing.RepositoryOptions;
import com.ryuqq.cutover.core.model.CorrelationId;
import com.ryuqq.cutover.core.model.ExpectedVersion;
import com.ryuqq.cutover.core.model.Payload;
import com.ryuqq.cutover.core.model.RecordKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * RoutedEventRepo 테스트.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
class RoutedEventRepoTest {

    private static final LocalDate MAY_FIRST = LocalDate.of(2024, 5, 1);

    private final InMemoryStoreAdapter primary = new InMemoryStoreAdapter("primary");
    private final InMemoryStoreAdapter legacy = new InMemoryStoreAdapter("legacy");

    private RepositoryFactory factory;

    @BeforeEach
    void setUp() {
        StoreFlags flags = StoreFlags.legacyOnly();
        factory = new RepositoryFactory(primary, legacy, flags,
            FlagsSource.fixed(flags), RepositoryOptions.defaults(Runnable::run));
    }

    private void createOrganization(String slug, String name, Hunt... hunts) {
        factory.orgRepo().upsert(slug, org -> {
            Organization next = org.withProfile(new OrgProfile(slug, name));
            for (Hunt hunt : hunts) {
                next = next.withHunt(hunt);
            }
            return next;
        });
        for (Hunt hunt : hunts) {
            factory.indexRepo().upsertDateEntry(hunt.startLocalDate(), slug, hunt.id());
        }
    }

    @Test
    void 조직이름과_이벤트이름_순으로_정렬한다() {
        // given
        createOrganization("globex", "Globex", Hunt.scheduled("g1", "Zeta Run", MAY_FIRST));
        createOrganization("acme", "Acme", Hunt.scheduled("a2", "Beta Walk", MAY_FIRST),
            Hunt.scheduled("a1", "Alpha Quest", MAY_FIRST));

        // when
        List<EventSummary> events = factory.eventRepo().listForDate(MAY_FIRST);

        // then
        assertThat(events).extracting(EventSummary::eventName)
            .containsExactly("Alpha Quest", "Beta Walk", "Zeta Run");
        assertThat(events.get(0).key()).isEqualTo("events/2024-05-01/acme/a1");
        assertThat(events.get(0).orgName()).isEqualTo("Acme");
    }

    @Test
    void 조직에서_사라진_hunt는_건너뛴다() {
        // given
        createOrganization("acme", "Acme", Hunt.scheduled("a1", "Alpha Quest", MAY_FIRST));
        legacy.put(RecordKey.dateIndex(MAY_FIRST, "acme", "ghost"),
            Payload.of("{\"date\":\"2024-05-01\",\"orgSlug\":\"acme\",\"huntId\":\"ghost\"}"),
            ExpectedVersion.any(), CorrelationId.of("test"));

        // when
        List<EventSummary> events = factory.eventRepo().listForDate(MAY_FIRST);

        // then
        assertThat(events).extracting(EventSummary::huntId).containsExactly("a1");
    }

    @Test
    void 다른_날짜의_이벤트는_포함하지_않는다() {
        // given
        createOrganization("acme", "Acme", Hunt.scheduled("a1", "Alpha Quest", MAY_FIRST.plusDays(1)));

        // when & then
        assertThat(factory.eventRepo().listForDate(MAY_FIRST)).isEmpty();
    }

    @Test
    void primary_우선_읽기에서_비어있는_primary는_legacy로_대체된다() {
        // given
        createOrganization("acme", "Acme", Hunt.scheduled("a1", "Alpha Quest", MAY_FIRST));
        factory.reload(new StoreFlags(true, true, true, false));

        // when
        List<EventSummary> events = factory.eventRepo().listForDate(MAY_FIRST);

        // then
        assertThat(events).extracting(EventSummary::huntId).containsExactly("a1");
        assertThat(primary.snapshot()).containsKey(RecordKey.dateIndex(MAY_FIRST, "acme", "a1"));
    }

    @Test
    void primary에_일부만_있어도_legacy에만_있는_항목을_함께_반환한다() {
        // given
        createOrganization("acme", "Acme", Hunt.scheduled("a1", "Alpha Quest", MAY_FIRST));
        createOrganization("globex", "Globex", Hunt.scheduled("g1", "Zeta Run", MAY_FIRST));
        factory.reload(new StoreFlags(true, true, true, false));
        factory.orgRepo().upsert("acme", org -> org.withHunt(
            Hunt.scheduled("a1", "Alpha Quest", MAY_FIRST).withStatus("live")));
        factory.indexRepo().upsertDateEntry(MAY_FIRST, "acme", "a1");
        assertThat(primary.snapshot()).doesNotContainKey(RecordKey.dateIndex(MAY_FIRST, "globex", "g1"));

        // when
        List<EventSummary> events = factory.eventRepo().listForDate(MAY_FIRST);

        // then
        assertThat(events).extracting(EventSummary::orgSlug).containsExactly("acme", "globex");
        assertThat(primary.snapshot()).containsKey(RecordKey.dateIndex(MAY_FIRST, "globex", "g1"));
    }
}
