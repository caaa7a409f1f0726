package com.ryuqq.cutover.application.config;

/**
 * 저장소 전환 플래그 스냅샷 (불변 record).
 *
 * <p>Repository Factory가 생성 시 주입받고, 명시적인 reload로만 교체됩니다.
 * 진행 중인 호출은 시작 시점의 스냅샷을 끝까지 사용합니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>primaryStoreEnabled: Primary 저장소 사용 여부 (PRIMARY_STORE_ENABLED)</li>
 *   <li>dualWriteEnabled: Primary + Legacy 이중 쓰기 (DUAL_WRITE_ENABLED)</li>
 *   <li>readPrimaryFirst: Primary 우선 읽기 + Legacy fallback (READ_PRIMARY_FIRST)</li>
 *   <li>localEmulatorEnabled: Primary로 로컬 에뮬레이터 사용 (LOCAL_EMULATOR_ENABLED)</li>
 * </ul>
 *
 * <p>모든 플래그의 기본값은 false이며, 이 경우 Legacy 저장소만 사용합니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 * @param primaryStoreEnabled Primary 저장소 사용 여부
 * @param dualWriteEnabled 이중 쓰기 여부
 * @param readPrimaryFirst Primary 우선 읽기 여부
 * @param localEmulatorEnabled 로컬 에뮬레이터 사용 여부
 */
public record StoreFlags(
    boolean primaryStoreEnabled,
    boolean dualWriteEnabled,
    boolean readPrimaryFirst,
    boolean localEmulatorEnabled
) {

    public static final String PRIMARY_STORE_ENABLED = "PRIMARY_STORE_ENABLED";
    public static final String DUAL_WRITE_ENABLED = "DUAL_WRITE_ENABLED";
    public static final String READ_PRIMARY_FIRST = "READ_PRIMARY_FIRST";
    public static final String LOCAL_EMULATOR_ENABLED = "LOCAL_EMULATOR_ENABLED";

    /**
     * 전환 이전 상태 (Legacy만 사용).
     */
    public static StoreFlags legacyOnly() {
        return new StoreFlags(false, false, false, false);
    }

    /**
     * 설정값에서 플래그 읽기.
     *
     * @param values 설정값
     * @return StoreFlags
     * @throws IllegalArgumentException boolean으로 해석할 수 없는 값이 있는 경우
     */
    public static StoreFlags from(ConfigValues values) {
        return new StoreFlags(
            values.getBoolean(PRIMARY_STORE_ENABLED, false),
            values.getBoolean(DUAL_WRITE_ENABLED, false),
            values.getBoolean(READ_PRIMARY_FIRST, false),
            values.getBoolean(LOCAL_EMULATOR_ENABLED, false)
        );
    }

    /**
     * primaryStoreEnabled만 변경한 새 인스턴스 생성.
     */
    public StoreFlags withPrimaryStoreEnabled(boolean primaryStoreEnabled) {
        return new StoreFlags(primaryStoreEnabled, dualWriteEnabled, readPrimaryFirst, localEmulatorEnabled);
    }

    /**
     * dualWriteEnabled만 변경한 새 인스턴스 생성.
     */
    public StoreFlags withDualWriteEnabled(boolean dualWriteEnabled) {
        return new StoreFlags(primaryStoreEnabled, dualWriteEnabled, readPrimaryFirst, localEmulatorEnabled);
    }

    /**
     * readPrimaryFirst만 변경한 새 인스턴스 생성.
     */
    public StoreFlags withReadPrimaryFirst(boolean readPrimaryFirst) {
        return new StoreFlags(primaryStoreEnabled, dualWriteEnabled, readPrimaryFirst, localEmulatorEnabled);
    }

    /**
     * localEmulatorEnabled만 변경한 새 인스턴스 생성.
     */
    public StoreFlags withLocalEmulatorEnabled(boolean localEmulatorEnabled) {
        return new StoreFlags(primaryStoreEnabled, dualWriteEnabled, readPrimaryFirst, localEmulatorEnabled);
    }
}
