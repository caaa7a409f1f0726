package com.ryuqq.cutover.application.coordinator;

import com.ryuqq.cutover.adapter.inmemory.store.InMemoryStoreAdapter;
import com.ryuqq.cutover.application.config.StoreFlags;
import com.ryuqq.cutover.application.document.Documents;
import com.ryuqq.cutover.application.document.Hunt;
import com.ryuqq.cutover.application.document.OrgProfile;
import com.ryuqq.cutover.application.document.Organization;
import com.ryuqq.cutover.application.document.OrganizationCodec;
import com.ryuqq.cutover.application.routing.Routes;
import com.ryuqq.cutover.application.routing.WriteOrder;
import com.ryuqq.cutover.core.model.CorrelationId;
import com.ryuqq.cutover.core.model.ExpectedVersion;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.model.StoredRecord;
import com.ryuqq.cutover.core.model.VersionToken;
import com.ryuqq.cutover.core.outcome.Conflict;
import com.ryuqq.cutover.core.outcome.Ok;
import com.ryuqq.cutover.core.outcome.Outcome;
import com.ryuqq.cutover.core.outcome.Unavailable;
import com.ryuqq.cutover.core.spi.RecordValidationException;
import com.ryuqq.cutover.core.spi.StoreUnavailableException;
import com.ryuqq.cutover.core.spi.VersionConflictException;
import com.ryuqq.cutover.testkit.store.RecordingStoreAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DualWriteCoordinator 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>첫 번째 쓰기 실패 시 두 번째 대상 미호출</li>
 *   <li>두 번째 쓰기 실패 시 부분 성공</li>
 *   <li>충돌 재시도 1회, 고정 버전 쓰기는 재시도 없음</li>
 *   <li>읽기 경로 기준의 변경 base 선택</li>
 * </ul>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
class DualWriteCoordinatorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T09:00:00Z");
    private static final RecordKey ACME = RecordKey.organization("acme");

    private static final Routes DUAL_READ_LEGACY = Routes.of(new StoreFlags(true, true, false, false));
    private static final Routes DUAL_READ_PRIMARY = Routes.of(new StoreFlags(true, true, true, false));
    private static final Routes PRIMARY_ONLY = Routes.of(new StoreFlags(true, false, true, false));

    private final OrganizationCodec codec = new OrganizationCodec(Documents.objectMapper());
    private final CorrelationId cid = CorrelationId.of("coordinator-test");
    private final Hunt spring = Hunt.scheduled("spring", "Spring Hunt", LocalDate.of(2024, 5, 1));

    private RecordingStoreAdapter primary;
    private RecordingStoreAdapter legacy;
    private DualWriteCoordinator coordinator;

    @BeforeEach
    void setUp() {
        primary = new RecordingStoreAdapter(new InMemoryStoreAdapter("primary"));
        legacy = new RecordingStoreAdapter(new InMemoryStoreAdapter("legacy"));
        coordinator = coordinator(WriteOrder.PRIMARY_FIRST);
    }

    private DualWriteCoordinator coordinator(WriteOrder order) {
        return new DualWriteCoordinator(primary, legacy, order, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private VersionToken seed(RecordingStoreAdapter store, Organization organization) {
        return store.getDelegate().put(ACME, codec.encode(organization), ExpectedVersion.any(), cid);
    }

    private Organization stored(RecordingStoreAdapter store) {
        StoredRecord record = store.getDelegate().get(ACME, cid).orElseThrow();
        return codec.decode(ACME, record.payload());
    }

    private static Organization acme() {
        return new Organization(null, null, new OrgProfile("acme", "Acme Corp"), List.of());
    }

    // ============================================================
    // 쓰기 순서와 실패
    // ============================================================

    @Test
    void 두_저장소에_순서대로_쓰고_updatedAt을_기록한다() {
        // when
        Outcome<Organization> outcome = coordinator.write(DUAL_READ_LEGACY, ACME, codec, org -> org.withHunt(spring), cid);

        // then
        assertThat(outcome.isOk()).isTrue();
        assertThat(((Ok<Organization>) outcome).partial()).isFalse();
        assertThat(outcome.value().updatedAt()).isEqualTo(NOW.toString());
        assertThat(stored(primary).hunts()).extracting(Hunt::id).containsExactly("spring");
        assertThat(stored(legacy).hunts()).extracting(Hunt::id).containsExactly("spring");
        assertThat(primary.putConditions()).containsExactly(ExpectedVersion.absent());
    }

    @Test
    void primary_쓰기가_실패하면_legacy는_호출하지_않는다() {
        // given
        primary.failPuts(key -> new StoreUnavailableException("primary", "connection refused"));

        // when
        Outcome<Organization> outcome = coordinator.write(DUAL_READ_LEGACY, ACME, codec, org -> org.withHunt(spring), cid);

        // then
        assertThat(outcome).isInstanceOf(Unavailable.class);
        assertThat(((Unavailable<Organization>) outcome).backend()).isEqualTo("primary");
        assertThat(legacy.putCount()).isZero();
        assertThat(legacy.getDelegate().get(ACME, cid)).isEmpty();
    }

    @Test
    void legacy_우선_순서에서_legacy가_실패하면_primary는_호출하지_않는다() {
        // given
        coordinator = coordinator(WriteOrder.LEGACY_FIRST);
        legacy.failPuts(key -> new StoreUnavailableException("legacy", "throttled"));

        // when
        Outcome<Organization> outcome = coordinator.write(DUAL_READ_LEGACY, ACME, codec, org -> org, cid);

        // then
        assertThat(outcome.isUnavailable()).isTrue();
        assertThat(primary.putCount()).isZero();
    }

    @Test
    void 두번째_쓰기가_실패하면_부분_성공이다() {
        // given
        legacy.failPuts(key -> new StoreUnavailableException("legacy", "timeout"));

        // when
        Outcome<Organization> outcome = coordinator.write(DUAL_READ_PRIMARY, ACME, codec, org -> org.withHunt(spring), cid);

        // then
        assertThat(outcome).isInstanceOf(Ok.class);
        assertThat(((Ok<Organization>) outcome).partial()).isTrue();
        assertThat(stored(primary).findHunt("spring")).isPresent();
        assertThat(legacy.getDelegate().get(ACME, cid)).isEmpty();
        assertThat(legacy.putCount()).isEqualTo(1);
    }

    @Test
    void 두번째_대상_로드가_실패해도_부분_성공이다() {
        // given
        seed(primary, acme());
        legacy.failGets(key -> new StoreUnavailableException("legacy", "timeout"));

        // when
        Outcome<Organization> outcome = coordinator.write(DUAL_READ_PRIMARY, ACME, codec, org -> org, cid);

        // then
        assertThat(((Ok<Organization>) outcome).partial()).isTrue();
        assertThat(legacy.putCount()).isZero();
    }

    @Test
    void 첫번째_대상_로드가_실패하면_Unavailable이다() {
        // given
        primary.failGets(key -> new StoreUnavailableException("primary", "down"));

        // when
        Outcome<Organization> outcome = coordinator.write(DUAL_READ_PRIMARY, ACME, codec, org -> org, cid);

        // then
        assertThat(outcome.isUnavailable()).isTrue();
        assertThat(primary.putCount()).isZero();
        assertThat(legacy.putCount()).isZero();
    }

    // ============================================================
    // 충돌
    // ============================================================

    @Test
    void 첫번째_충돌은_재로드후_한번_재시도한다() {
        // given
        primary.failPuts(1, key -> new VersionConflictException("primary", key, ExpectedVersion.absent()));

        // when
        Outcome<Organization> outcome = coordinator.write(DUAL_READ_LEGACY, ACME, codec, org -> org.withHunt(spring), cid);

        // then
        assertThat(outcome.isOk()).isTrue();
        assertThat(primary.putCount()).isEqualTo(2);
        assertThat(legacy.putCount()).isEqualTo(1);
    }

    @Test
    void 재시도에서도_충돌하면_Conflict다() {
        // given
        primary.failPuts(2, key -> new VersionConflictException("primary", key, ExpectedVersion.absent()));

        // when
        Outcome<Organization> outcome = coordinator.write(DUAL_READ_LEGACY, ACME, codec, org -> org, cid);

        // then
        assertThat(outcome).isInstanceOf(Conflict.class);
        assertThat(((Conflict<Organization>) outcome).key()).isEqualTo(ACME);
        assertThat(primary.putCount()).isEqualTo(2);
        assertThat(legacy.putCount()).isZero();
    }

    @Test
    void 고정_버전이_오래되면_쓰기없이_Conflict다() {
        // given
        VersionToken first = seed(primary, acme());
        seed(primary, acme().withHunt(spring));

        // when
        Outcome<Organization> outcome = coordinator.writePinned(
            PRIMARY_ONLY, ACME, codec, first, org -> org.withProfile(org.org().withOrgName("Acme Inc")), cid);

        // then
        assertThat(outcome.isConflict()).isTrue();
        assertThat(primary.putCount()).isZero();
        assertThat(stored(primary).org().orgName()).isEqualTo("Acme Corp");
    }

    @Test
    void 고정_버전_쓰기는_충돌을_재시도하지_않는다() {
        // given
        VersionToken current = seed(primary, acme());
        primary.failPuts(1, key -> new VersionConflictException("primary", key, ExpectedVersion.matching(current)));

        // when
        Outcome<Organization> outcome = coordinator.writePinned(PRIMARY_ONLY, ACME, codec, current, org -> org, cid);

        // then
        assertThat(outcome.isConflict()).isTrue();
        assertThat(primary.putCount()).isEqualTo(1);
    }

    // ============================================================
    // base 선택과 반환 토큰
    // ============================================================

    @Test
    void primary에_없으면_legacy_문서를_base로_사용한다() {
        // given
        seed(legacy, acme().withHunt(spring));
        Hunt fall = Hunt.scheduled("fall", "Fall Hunt", LocalDate.of(2024, 10, 1));

        // when
        Outcome<Organization> outcome = coordinator.write(DUAL_READ_PRIMARY, ACME, codec, org -> org.withHunt(fall), cid);

        // then
        assertThat(outcome.isOk()).isTrue();
        assertThat(stored(primary).hunts()).extracting(Hunt::id).containsExactly("spring", "fall");
        assertThat(stored(primary).org().orgName()).isEqualTo("Acme Corp");
        assertThat(primary.putConditions()).containsExactly(ExpectedVersion.absent());
    }

    @Test
    void 반환_토큰은_읽기를_서비스하는_저장소의_토큰이다() {
        // when
        Outcome<Organization> outcome = coordinator.write(DUAL_READ_LEGACY, ACME, codec, org -> org, cid);

        // then
        VersionToken legacyToken = legacy.getDelegate().get(ACME, cid).orElseThrow().version();
        assertThat(((Ok<Organization>) outcome).version()).isEqualTo(legacyToken);
    }

    @Test
    void slug를_바꾸는_변경은_쓰기전에_거부된다() {
        // when & then
        assertThatThrownBy(() -> coordinator.write(DUAL_READ_LEGACY, ACME, codec,
            org -> org.withProfile(new OrgProfile("other", "Other")), cid))
            .isInstanceOf(RecordValidationException.class);
        assertThat(primary.putCount()).isZero();
        assertThat(legacy.putCount()).isZero();
    }
}
