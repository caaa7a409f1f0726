package com.ryuqq.cutover.application.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.cutover.application.config.FlagsSource;
import com.ryuqq.cutover.application.config.StoreFlags;
import com.ryuqq.cutover.application.coordinator.DualWriteCoordinator;
import com.ryuqq.cutover.application.document.DateIndexEntryCodec;
import com.ryuqq.cutover.application.document.Documents;
import com.ryuqq.cutover.application.document.OrganizationCodec;
import com.ryuqq.cutover.application.fallback.ReadThroughFallback;
import com.ryuqq.cutover.application.repository.EventRepo;
import com.ryuqq.cutover.application.repository.IndexRepo;
import com.ryuqq.cutover.application.repository.OrgRepo;
import com.ryuqq.cutover.application.repository.RoutedEventRepo;
import com.ryuqq.cutover.application.repository.RoutedIndexRepo;
import com.ryuqq.cutover.application.repository.RoutedOrgRepo;
import com.ryuqq.cutover.core.spi.StoreAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Repository Factory.
 *
 * <p>플래그 스냅샷을 {@link AtomicReference}에 보관하고, Repository 호출마다 그 시점의
 * {@link Routes}를 한 번 읽어 사용합니다. 플래그 변경은 다음 호출부터 반영되며,
 * 진행 중인 호출은 시작할 때의 스냅샷을 유지합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RepositoryFactory factory = RepositoryFactory.create(
 *     primaryAdapter, legacyAdapter, new EnvironmentFlagsSource(), RepositoryOptions.defaults(executor));
 *
 * OrgRepo orgs = factory.orgRepo();
 * Outcome&lt;Organization&gt; result = orgs.upsert("acme", org -&gt; org.withHunt(hunt));
 * </pre>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class RepositoryFactory {

    private static final Logger log = LoggerFactory.getLogger(RepositoryFactory.class);

    private final StoreAdapter primary;
    private final StoreAdapter legacy;
    private final FlagsSource flagsSource;
    private final AtomicReference<Routes> routes;

    private final OrgRepo orgRepo;
    private final EventRepo eventRepo;
    private final IndexRepo indexRepo;

    /**
     * 생성자.
     *
     * @param primary Primary 저장소
     * @param legacy Legacy 저장소
     * @param initialFlags 최초 스냅샷
     * @param flagsSource reload() 시 사용할 공급원
     * @param options 동작 설정
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public RepositoryFactory(
        StoreAdapter primary,
        StoreAdapter legacy,
        StoreFlags initialFlags,
        FlagsSource flagsSource,
        RepositoryOptions options
    ) {
        if (primary == null) {
            throw new IllegalArgumentException("primary cannot be null");
        }
        if (legacy == null) {
            throw new IllegalArgumentException("legacy cannot be null");
        }
        if (initialFlags == null) {
            throw new IllegalArgumentException("initialFlags cannot be null");
        }
        if (flagsSource == null) {
            throw new IllegalArgumentException("flagsSource cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        this.primary = primary;
        this.legacy = legacy;
        this.flagsSource = flagsSource;
        this.routes = new AtomicReference<>(Routes.of(initialFlags));

        ObjectMapper objectMapper = Documents.objectMapper();
        OrganizationCodec orgCodec = new OrganizationCodec(objectMapper);
        DateIndexEntryCodec indexCodec = new DateIndexEntryCodec(objectMapper);
        ReadThroughFallback fallback = new ReadThroughFallback(primary, legacy, options.backfillExecutor());
        DualWriteCoordinator coordinator = new DualWriteCoordinator(
            primary, legacy, options.writeOrder(), options.clock());

        this.orgRepo = new RoutedOrgRepo(this::routes, fallback, coordinator, orgCodec);
        this.eventRepo = new RoutedEventRepo(() -> routes().read(), fallback, indexCodec, orgCodec);
        this.indexRepo = new RoutedIndexRepo(this::routes, fallback, coordinator, indexCodec, orgCodec);

        log.info("RepositoryFactory initialized: primary={}, legacy={}, routes={}",
            primary.name(), legacy.name(), routes.get());
    }

    /**
     * 공급원에서 최초 스냅샷을 읽어 생성.
     */
    public static RepositoryFactory create(
        StoreAdapter primary,
        StoreAdapter legacy,
        FlagsSource flagsSource,
        RepositoryOptions options
    ) {
        if (flagsSource == null) {
            throw new IllegalArgumentException("flagsSource cannot be null");
        }
        return new RepositoryFactory(primary, legacy, flagsSource.load(), flagsSource, options);
    }

    /**
     * 공급원에서 새 스냅샷을 읽어 교체.
     *
     * @return 적용된 플래그
     * @throws IllegalArgumentException 설정값이 잘못된 경우 (기존 스냅샷 유지)
     */
    public StoreFlags reload() {
        return reload(flagsSource.load());
    }

    /**
     * 주어진 스냅샷으로 교체.
     *
     * @param flags 새 플래그
     * @return 적용된 플래그
     */
    public StoreFlags reload(StoreFlags flags) {
        Routes next = Routes.of(flags);
        Routes previous = routes.getAndSet(next);
        if (!previous.flags().equals(flags)) {
            log.info("Store flags changed: {} -> {} (read={}, write={})",
                previous.flags(), flags, next.read(), next.write());
        }
        return flags;
    }

    public StoreFlags currentFlags() {
        return routes.get().flags();
    }

    /**
     * 현재 스냅샷의 경로.
     */
    public Routes routes() {
        return routes.get();
    }

    /**
     * 역할에 해당하는 저장소.
     */
    public StoreAdapter adapter(StoreRole role) {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        return role == StoreRole.PRIMARY ? primary : legacy;
    }

    public OrgRepo orgRepo() {
        return orgRepo;
    }

    public EventRepo eventRepo() {
        return eventRepo;
    }

    public IndexRepo indexRepo() {
        return indexRepo;
    }
}
