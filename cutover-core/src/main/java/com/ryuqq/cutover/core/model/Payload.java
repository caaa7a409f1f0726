package com.ryuqq.cutover.core.model;

/**
 * 저장 레코드에 담기는 직렬화된 문서.
 *
 * <p>Store Adapter는 Payload의 내용을 해석하지 않습니다. 직렬화 형식은 상위 계층
 * (문서 코덱)이 결정하며, 이 시스템에서는 JSON 문자열을 사용합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>Organization: Payload.of("{\"schemaVersion\":\"1.0.0\",\"org\":{...},\"hunts\":[]}")</li>
 *   <li>DateIndex 항목: Payload.of("{\"date\":\"2025-08-08\",\"orgSlug\":\"acme\",\"huntId\":\"h1\"}")</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class Payload {

    private final String value;

    private Payload(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        this.value = value;
    }

    /**
     * Payload 생성.
     *
     * @param value 직렬화된 문서 (null 불가)
     * @return Payload 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static Payload of(String value) {
        return new Payload(value);
    }

    /**
     * Payload 값 조회.
     *
     * @return 직렬화된 문서
     */
    public String getValue() {
        return value;
    }

    /**
     * Payload가 비어있는지 확인.
     *
     * @return 비어있으면 true
     */
    public boolean isEmpty() {
        return value.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return value.equals(payload.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Payload{" + value.length() + " chars}";
    }
}
