/**
 * 저장 레코드 모델 패키지.
 *
 * <p>두 저장소가 공유하는 키 체계와 값 객체를 정의합니다.</p>
 *
 * <h2>주요 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cutover.core.model.RecordKey} - (table, partitionKey, rowKey) 복합 키</li>
 *   <li>{@link com.ryuqq.cutover.core.model.VersionToken} - 불투명 버전 토큰</li>
 *   <li>{@link com.ryuqq.cutover.core.model.ExpectedVersion} - put 조건</li>
 *   <li>{@link com.ryuqq.cutover.core.model.StoredRecord} - 읽기 결과</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Cutover Team
 */
package com.ryuqq.cutover.core.model;
