package com.ryuqq.cutover.application.config;

import com.ryuqq.cutover.core.protection.RetryPolicy;

import java.nio.file.Path;

/**
 * 저장소 위치와 재시도 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>LEGACY_STORE_ROOT: Legacy 저장소 디렉터리 (기본 ./data/legacy)</li>
 *   <li>PRIMARY_STORE_ROOT: Primary 저장소 디렉터리 (기본 ./data/primary)</li>
 *   <li>EMULATOR_STORE_ROOT: LOCAL_EMULATOR_ENABLED일 때 Primary 대신 쓰는 디렉터리 (기본 ./data/emulator)</li>
 *   <li>STORE_RETRY_BASE_MS / STORE_RETRY_MAX_MS / STORE_RETRY_MAX_ATTEMPTS: 어댑터 재시도 정책</li>
 * </ul>
 *
 * @author Cutover Team
 * @since 1.0.0
 * @param legacyRoot Legacy 저장소 디렉터리
 * @param primaryRoot Primary 저장소 디렉터리
 * @param emulatorRoot 로컬 에뮬레이터 디렉터리
 * @param retryPolicy 어댑터 재시도 정책
 */
public record StoreSettings(
    Path legacyRoot,
    Path primaryRoot,
    Path emulatorRoot,
    RetryPolicy retryPolicy
) {

    public static final String LEGACY_STORE_ROOT = "LEGACY_STORE_ROOT";
    public static final String PRIMARY_STORE_ROOT = "PRIMARY_STORE_ROOT";
    public static final String EMULATOR_STORE_ROOT = "EMULATOR_STORE_ROOT";
    public static final String STORE_RETRY_BASE_MS = "STORE_RETRY_BASE_MS";
    public static final String STORE_RETRY_MAX_MS = "STORE_RETRY_MAX_MS";
    public static final String STORE_RETRY_MAX_ATTEMPTS = "STORE_RETRY_MAX_ATTEMPTS";

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public StoreSettings {
        if (legacyRoot == null) {
            throw new IllegalArgumentException("legacyRoot cannot be null");
        }
        if (primaryRoot == null) {
            throw new IllegalArgumentException("primaryRoot cannot be null");
        }
        if (emulatorRoot == null) {
            throw new IllegalArgumentException("emulatorRoot cannot be null");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
    }

    /**
     * 설정값에서 읽기.
     *
     * @param values 설정값
     * @return StoreSettings
     * @throws IllegalArgumentException 숫자/범위가 잘못된 경우
     */
    public static StoreSettings from(ConfigValues values) {
        RetryPolicy defaults = new RetryPolicy();
        RetryPolicy retryPolicy = new RetryPolicy(
            values.getLong(STORE_RETRY_BASE_MS, defaults.baseDelayMs()),
            values.getLong(STORE_RETRY_MAX_MS, defaults.maxDelayMs()),
            (int) values.getLong(STORE_RETRY_MAX_ATTEMPTS, defaults.maxRetries()),
            defaults.jitterFactor()
        );
        return new StoreSettings(
            Path.of(values.get(LEGACY_STORE_ROOT).orElse("data/legacy")),
            Path.of(values.get(PRIMARY_STORE_ROOT).orElse("data/primary")),
            Path.of(values.get(EMULATOR_STORE_ROOT).orElse("data/emulator")),
            retryPolicy
        );
    }

    /**
     * 플래그에 따른 실제 Primary 디렉터리.
     *
     * @param flags 플래그 스냅샷
     * @return 에뮬레이터 사용 시 emulatorRoot, 아니면 primaryRoot
     */
    public Path effectivePrimaryRoot(StoreFlags flags) {
        return flags.localEmulatorEnabled() ? emulatorRoot : primaryRoot;
    }
}
