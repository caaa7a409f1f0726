package com.ryuqq.cutover.core.model;

import java.util.Objects;

/**
 * put 호출 시 제시하는 기대 버전 조건.
 *
 * <p>세 가지 조건이 있습니다:</p>
 * <ul>
 *   <li>{@link #any()}: 무조건 create-or-replace. Migration Engine 전용이며,
 *       애플리케이션 쓰기 경로에서는 사용하지 않습니다.</li>
 *   <li>{@link #absent()}: 키가 존재하지 않을 때만 생성.</li>
 *   <li>{@link #matching(VersionToken)}: 현재 토큰이 일치할 때만 교체.</li>
 * </ul>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class ExpectedVersion {

    private static final ExpectedVersion ANY = new ExpectedVersion(Mode.ANY, null);
    private static final ExpectedVersion ABSENT = new ExpectedVersion(Mode.ABSENT, null);

    private enum Mode { ANY, ABSENT, MATCHING }

    private final Mode mode;
    private final VersionToken token;

    private ExpectedVersion(Mode mode, VersionToken token) {
        this.mode = mode;
        this.token = token;
    }

    /**
     * 무조건 쓰기.
     */
    public static ExpectedVersion any() {
        return ANY;
    }

    /**
     * 신규 생성 전용.
     */
    public static ExpectedVersion absent() {
        return ABSENT;
    }

    /**
     * 토큰 일치 조건.
     *
     * @param token 마지막으로 읽은 토큰
     * @return ExpectedVersion
     * @throws IllegalArgumentException token이 null인 경우
     */
    public static ExpectedVersion matching(VersionToken token) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        return new ExpectedVersion(Mode.MATCHING, token);
    }

    /**
     * 읽은 토큰으로부터 조건 생성 (토큰이 없으면 신규 생성 조건).
     *
     * @param token 읽은 토큰 (null이면 레코드가 없었음을 의미)
     * @return matching(token) 또는 absent()
     */
    public static ExpectedVersion of(VersionToken token) {
        return token == null ? ABSENT : matching(token);
    }

    /**
     * 현재 저장 상태가 조건을 만족하는지 확인.
     *
     * @param current 현재 토큰 (레코드가 없으면 null)
     * @return 조건 충족 여부
     */
    public boolean isSatisfiedBy(VersionToken current) {
        switch (mode) {
            case ANY:
                return true;
            case ABSENT:
                return current == null;
            default:
                return token.equals(current);
        }
    }

    public boolean isUnconditional() {
        return mode == Mode.ANY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExpectedVersion that = (ExpectedVersion) o;
        return mode == that.mode && Objects.equals(token, that.token);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, token);
    }

    @Override
    public String toString() {
        return switch (mode) {
            case ANY -> "ExpectedVersion{any}";
            case ABSENT -> "ExpectedVersion{absent}";
            case MATCHING -> "ExpectedVersion{" + token.getValue() + '}';
        };
    }
}
