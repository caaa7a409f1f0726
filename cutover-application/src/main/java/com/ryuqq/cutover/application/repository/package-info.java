/**
 * Repository Port와 플래그 경로 기반 구현체.
 *
 * <p>서비스 코드는 {@link com.ryuqq.cutover.application.repository.OrgRepo},
 * {@link com.ryuqq.cutover.application.repository.EventRepo},
 * {@link com.ryuqq.cutover.application.repository.IndexRepo}만 사용하며,
 * 구현체는 {@link com.ryuqq.cutover.application.routing.RepositoryFactory}가 만듭니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
package com.ryuqq.cutover.application.repository;
