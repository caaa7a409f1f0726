package com.ryuqq.cutover.application.routing;

import com.ryuqq.cutover.application.config.StoreFlags;

/**
 * 한 호출이 사용하는 읽기/쓰기 경로 (불변 record).
 *
 * <p>호출 시작 시점의 플래그 스냅샷에서 한 번 계산되며, 호출이 끝날 때까지 바뀌지 않습니다.</p>
 *
 * <p><strong>라우팅 표:</strong></p>
 * <pre>
 * primary | dual  | readPrimaryFirst | read                  | write
 * --------+-------+------------------+-----------------------+-------------
 * false   | *     | *                | LEGACY_ONLY           | LEGACY_ONLY
 * true    | true  | false            | LEGACY_ONLY           | DUAL
 * true    | true  | true             | PRIMARY_WITH_FALLBACK | DUAL
 * true    | false | true             | PRIMARY_WITH_FALLBACK | PRIMARY_ONLY
 * true    | false | false            | LEGACY_ONLY           | LEGACY_ONLY
 * </pre>
 *
 * @author Cutover Team
 * @since 1.0.0
 * @param flags 기준 스냅샷
 * @param read 읽기 경로
 * @param write 쓰기 경로
 */
public record Routes(
    StoreFlags flags,
    ReadRoute read,
    WriteRoute write
) {

    public Routes {
        if (flags == null) {
            throw new IllegalArgumentException("flags cannot be null");
        }
        if (read == null) {
            throw new IllegalArgumentException("read cannot be null");
        }
        if (write == null) {
            throw new IllegalArgumentException("write cannot be null");
        }
    }

    /**
     * 플래그 스냅샷으로부터 경로 계산.
     *
     * @param flags 플래그 스냅샷
     * @return Routes
     */
    public static Routes of(StoreFlags flags) {
        if (flags == null) {
            throw new IllegalArgumentException("flags cannot be null");
        }
        if (!flags.primaryStoreEnabled()) {
            return new Routes(flags, ReadRoute.LEGACY_ONLY, WriteRoute.LEGACY_ONLY);
        }
        ReadRoute read = flags.readPrimaryFirst() ? ReadRoute.PRIMARY_WITH_FALLBACK : ReadRoute.LEGACY_ONLY;
        WriteRoute write;
        if (flags.dualWriteEnabled()) {
            write = WriteRoute.DUAL;
        } else if (flags.readPrimaryFirst()) {
            write = WriteRoute.PRIMARY_ONLY;
        } else {
            write = WriteRoute.LEGACY_ONLY;
        }
        return new Routes(flags, read, write);
    }

    /**
     * 다음 읽기를 서비스할 저장소.
     *
     * <p>쓰기 결과로 돌려줄 버전 토큰을 고를 때 사용합니다. 호출자가 그 토큰을 다음
     * 쓰기에 제시하면 같은 저장소의 토큰과 비교됩니다.</p>
     */
    public StoreRole servingRole() {
        return read == ReadRoute.LEGACY_ONLY ? StoreRole.LEGACY : StoreRole.PRIMARY;
    }
}
