/**
 * Repository 쓰기 결과 패키지.
 *
 * <p>Sealed {@link com.ryuqq.cutover.core.outcome.Outcome} 계층으로 Ok, Conflict,
 * Unavailable 세 가지 결과만 허용합니다.</p>
 *
 * @since 1.0.0
 * @author Cutover Team
 */
package com.ryuqq.cutover.core.outcome;
