package com.ryuqq.cutover.application.repository;

import com.ryuqq.cutover.adapter.inmemory.store.InMemoryStoreAdapter;
import com.ryuqq.cutover.application.config.FlagsSource;
import com.ryuqq.cutover.application.config.StoreFlags;
import com.ryuqq.cutover.application.document.Hunt;
import com.ryuqq.cutover.application.document.OrgProfile;
import com.ryuqq.cutover.application.document.Organization;
import com.ryuqq.cutover.application.routing.RepositoryFactory;
import com.ryuqq.cutover.application.routing.RepositoryOptions;
import com.ryuqq.cutover.application.routing.StoreRole;
import com.ryuqq.cutover.core.outcome.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RoutedOrgRepo 테스트.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
class RoutedOrgRepoTest {

    private static final StoreFlags DUAL_READ_PRIMARY = new StoreFlags(true, true, true, false);

    private final InMemoryStoreAdapter primary = new InMemoryStoreAdapter("primary");
    private final InMemoryStoreAdapter legacy = new InMemoryStoreAdapter("legacy");

    private RepositoryFactory factory;
    private OrgRepo orgRepo;

    @BeforeEach
    void setUp() {
        factory = new RepositoryFactory(primary, legacy, DUAL_READ_PRIMARY,
            FlagsSource.fixed(DUAL_READ_PRIMARY), RepositoryOptions.defaults(Runnable::run));
        orgRepo = factory.orgRepo();
    }

    private static Hunt hunt(String id) {
        return Hunt.scheduled(id, "Hunt " + id, LocalDate.of(2024, 5, 1));
    }

    @Test
    void upsert후_get으로_같은_문서를_읽는다() {
        // given
        orgRepo.upsert("acme", org -> org.withProfile(new OrgProfile("acme", "Acme Corp")).withHunt(hunt("spring")));

        // when
        Organization organization = orgRepo.get("acme").orElseThrow();

        // then
        assertThat(organization.org().orgName()).isEqualTo("Acme Corp");
        assertThat(organization.hunts()).extracting(Hunt::id).containsExactly("spring");
        assertThat(legacy.size()).isEqualTo(1);
        assertThat(primary.size()).isEqualTo(1);
    }

    @Test
    void 없는_조직은_empty다() {
        assertThat(orgRepo.get("nobody")).isEmpty();
    }

    @Test
    void 같은_토큰으로_동시에_hunt를_추가하면_하나만_성공한다() throws Exception {
        // given
        orgRepo.upsert("acme", org -> org.withProfile(new OrgProfile("acme", "Acme Corp")));
        Versioned<Organization> read = orgRepo.getVersioned("acme").orElseThrow();
        assertThat(read.servedBy()).isEqualTo(StoreRole.PRIMARY);

        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Outcome<Organization>>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                String huntId = "hunt-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return orgRepo.upsert("acme", read.version(), org -> org.withHunt(hunt(huntId)));
                }));
            }

            // when
            start.countDown();
            List<Outcome<Organization>> outcomes = new ArrayList<>();
            for (Future<Outcome<Organization>> future : futures) {
                outcomes.add(future.get(10, TimeUnit.SECONDS));
            }

            // then
            assertThat(outcomes).filteredOn(Outcome::isOk).hasSize(1);
            assertThat(outcomes).filteredOn(Outcome::isConflict).hasSize(writers - 1);
            assertThat(orgRepo.get("acme").orElseThrow().hunts()).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void 고정_버전_upsert는_최신_토큰이면_성공한다() {
        // given
        orgRepo.upsert("acme", org -> org);
        Versioned<Organization> read = orgRepo.getVersioned("acme").orElseThrow();

        // when
        Outcome<Organization> outcome = orgRepo.upsert("acme", read.version(), org -> org.withHunt(hunt("spring")));

        // then
        assertThat(outcome.isOk()).isTrue();
        assertThat(outcome.value().findHunt("spring")).isPresent();
    }

    @Test
    void 공백_slug는_거부한다() {
        assertThatThrownBy(() -> orgRepo.get(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("orgSlug");
    }
}
