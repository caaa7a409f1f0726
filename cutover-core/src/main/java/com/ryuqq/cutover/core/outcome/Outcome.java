package com.ryuqq.cutover.core.outcome;

/**
 * Repository 쓰기 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 쓰기 성공 (보조 저장소 실패 시 partial)</li>
 *   <li>{@link Conflict}: 버전 충돌, 호출자가 재로드 후 재시도 가능</li>
 *   <li>{@link Unavailable}: 백엔드 접근 불가 (재시도 소진)</li>
 * </ul>
 *
 * <p>NotFound는 오류가 아니므로 Outcome에 포함되지 않고 {@code Optional.empty()}로 표현합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome&lt;Organization&gt; outcome = orgRepo.upsert("acme", org -&gt; org.withHunt(hunt));
 * if (outcome.isOk()) {
 *     Organization saved = ((Ok&lt;Organization&gt;) outcome).value();
 * }
 * </pre>
 *
 * @param <T> 결과 문서 타입
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Ok, Conflict, Unavailable {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 버전 충돌인지 확인.
     *
     * @return 충돌 여부
     */
    default boolean isConflict() {
        return this instanceof Conflict;
    }

    /**
     * 결과가 백엔드 불가인지 확인.
     *
     * @return 불가 여부
     */
    default boolean isUnavailable() {
        return this instanceof Unavailable;
    }

    /**
     * 성공 값 조회.
     *
     * @return 성공 시 저장된 문서
     * @throws IllegalStateException Ok가 아닌 경우
     */
    default T value() {
        if (this instanceof Ok<T> ok) {
            return ok.document();
        }
        throw new IllegalStateException("Outcome is not Ok: " + this);
    }
}
