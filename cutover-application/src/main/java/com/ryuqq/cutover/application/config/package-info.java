/**
 * 설정 패키지.
 *
 * <p>전환 플래그는 전역 가변 상태가 아니라 주입되는 스냅샷({@link com.ryuqq.cutover.application.config.StoreFlags})이며,
 * {@link com.ryuqq.cutover.application.routing.RepositoryFactory#reload()}로만 교체됩니다.</p>
 *
 * @since 1.0.0
 * @author Cutover Team
 */
package com.ryuqq.cutover.application.config;
