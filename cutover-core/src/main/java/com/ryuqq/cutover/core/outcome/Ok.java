package com.ryuqq.cutover.core.outcome;

import com.ryuqq.cutover.core.model.VersionToken;

/**
 * 성공 결과.
 *
 * <p>첫 번째 대상(기본: Primary)에 쓰기가 완료되었음을 나타냅니다.
 * {@code partial}이 true이면 두 번째 대상 쓰기가 실패했으며, 이는 로그로만 기록되고
 * 호출자에게 실패로 드러나지 않습니다.</p>
 *
 * @param document 저장된 문서
 * @param version 첫 번째 대상이 발급한 버전 토큰
 * @param partial 보조 저장소 쓰기 실패 여부
 * @param <T> 문서 타입
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public record Ok<T>(
    T document,
    VersionToken version,
    boolean partial
) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException document 또는 version이 null인 경우
     */
    public Ok {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        if (version == null) {
            throw new IllegalArgumentException("version cannot be null");
        }
    }

    /**
     * 완전한 성공 결과 생성.
     */
    public static <T> Ok<T> of(T document, VersionToken version) {
        return new Ok<>(document, version, false);
    }

    /**
     * 부분 성공 결과 생성.
     */
    public static <T> Ok<T> partial(T document, VersionToken version) {
        return new Ok<>(document, version, true);
    }
}
