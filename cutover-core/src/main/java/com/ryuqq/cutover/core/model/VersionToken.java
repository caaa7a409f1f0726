package com.ryuqq.cutover.core.model;

/**
 * 낙관적 동시성 제어용 버전 토큰.
 *
 * <p>저장소가 발급하는 불투명(opaque) 값입니다. 이 시스템은 토큰의 내부 구조를
 * 해석하지 않으며, 오직 동등성 비교에만 사용합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>성공한 쓰기마다 새로운 토큰이 발급됨</li>
 *   <li>read-modify-write는 읽었던 토큰을 제시해야 하며, 불일치 시 거부됨</li>
 * </ul>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class VersionToken {

    private final String value;

    private VersionToken(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("VersionToken cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * VersionToken 생성.
     *
     * @param value 백엔드가 발급한 토큰 값
     * @return VersionToken 인스턴스
     * @throws IllegalArgumentException 값이 null이거나 공백인 경우
     */
    public static VersionToken of(String value) {
        return new VersionToken(value);
    }

    /**
     * 토큰 값 조회.
     *
     * @return 토큰 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VersionToken that = (VersionToken) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "VersionToken{" + value + '}';
    }
}
