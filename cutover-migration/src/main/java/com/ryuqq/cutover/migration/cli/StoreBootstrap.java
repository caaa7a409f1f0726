package com.ryuqq.cutover.migration.cli;

import com.ryuqq.cutover.adapter.filesystem.FileSystemStoreAdapter;
import com.ryuqq.cutover.application.config.ConfigValues;
import com.ryuqq.cutover.application.config.StoreFlags;
import com.ryuqq.cutover.application.config.StoreSettings;
import com.ryuqq.cutover.core.protection.RetryingStoreAdapter;
import com.ryuqq.cutover.core.spi.StoreAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * 명령행 도구용 저장소 구성.
 *
 * <p>설정값(환경 변수, 시스템 속성, cutover.properties)에서 Legacy/Primary 디렉터리를 읽고
 * 재시도 정책을 적용한 파일 저장소 어댑터를 만듭니다. LOCAL_EMULATOR_ENABLED이면 Primary는
 * EMULATOR_STORE_ROOT를 사용합니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 * @param legacy Legacy 저장소
 * @param primary Primary 저장소
 */
public record StoreBootstrap(StoreAdapter legacy, StoreAdapter primary) {

    private static final Logger log = LoggerFactory.getLogger(StoreBootstrap.class);

    public StoreBootstrap {
        if (legacy == null) {
            throw new IllegalArgumentException("legacy cannot be null");
        }
        if (primary == null) {
            throw new IllegalArgumentException("primary cannot be null");
        }
    }

    /**
     * 설정값에서 저장소 구성.
     *
     * @param values 설정값
     * @return StoreBootstrap
     * @throws IllegalArgumentException 설정값이 잘못된 경우
     */
    public static StoreBootstrap from(ConfigValues values) {
        StoreSettings settings = StoreSettings.from(values);
        StoreFlags flags = StoreFlags.from(values);

        Path primaryRoot = settings.effectivePrimaryRoot(flags);
        String primaryName = flags.localEmulatorEnabled() ? "emulator" : "primary";
        log.info("Stores: legacy={}, {}={}", settings.legacyRoot(), primaryName, primaryRoot);

        return new StoreBootstrap(
            new RetryingStoreAdapter(new FileSystemStoreAdapter("legacy", settings.legacyRoot()), settings.retryPolicy()),
            new RetryingStoreAdapter(new FileSystemStoreAdapter(primaryName, primaryRoot), settings.retryPolicy())
        );
    }
}
