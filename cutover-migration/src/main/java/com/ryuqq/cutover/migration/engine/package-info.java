/**
 * Migration/Backfill Engine.
 *
 * <p>{@link com.ryuqq.cutover.migration.engine.MigrationEngine}이 Legacy 저장소의 조직 문서를
 * 검증하고 {@link com.ryuqq.cutover.migration.engine.WritePlanner}가 만든 쓰기 목록을 Primary에 반영합니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
package com.ryuqq.cutover.migration.engine;
