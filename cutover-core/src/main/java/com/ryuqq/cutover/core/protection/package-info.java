/**
 * 백엔드 호출 보호 패키지.
 *
 * <p>어댑터 호출 단위의 재시도를 담당합니다. 논리 연산 단위가 아니라 백엔드 호출 단위로
 * 적용되므로, 이중 쓰기 한 번은 최악의 경우 (호출 타임아웃 × 재시도 횟수 × 2 어댑터) 만큼
 * 걸릴 수 있습니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.cutover.core.protection.RetryPolicy} - 재시도 정책</li>
 *   <li>{@link com.ryuqq.cutover.core.protection.BackoffCalculator} - 지수 백오프 + Jitter</li>
 *   <li>{@link com.ryuqq.cutover.core.protection.RetryingStoreAdapter} - 재시도 데코레이터</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Cutover Team
 */
package com.ryuqq.cutover.core.protection;
