package com.ryuqq.cutover.application.config;

import java.util.function.Supplier;

/**
 * 환경 변수, 시스템 프로퍼티, {@code cutover.properties}에서 플래그를 읽는 공급원.
 *
 * <p>호출마다 설정 소스를 다시 읽으므로, 실행 중 바뀐 시스템 프로퍼티도 다음 reload에 반영됩니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class EnvironmentFlagsSource implements FlagsSource {

    private final Supplier<ConfigValues> values;

    public EnvironmentFlagsSource() {
        this(ConfigValues::load);
    }

    public EnvironmentFlagsSource(Supplier<ConfigValues> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        this.values = values;
    }

    @Override
    public StoreFlags load() {
        return StoreFlags.from(values.get());
    }
}
