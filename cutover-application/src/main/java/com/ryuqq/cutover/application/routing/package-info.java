/**
 * 플래그 기반 라우팅.
 *
 * <p>{@link com.ryuqq.cutover.application.routing.Routes}는 플래그 스냅샷에서 계산한
 * 읽기/쓰기 경로이며, {@link com.ryuqq.cutover.application.routing.RepositoryFactory}가
 * 호출마다 현재 스냅샷의 경로를 Repository에 넘깁니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
package com.ryuqq.cutover.application.routing;
