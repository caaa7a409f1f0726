/**
 * Read-Through Fallback.
 *
 * <p>Primary를 먼저 읽고, 없거나 장애일 때 Legacy를 읽습니다. Primary가 NotFound로 답한
 * 키를 Legacy에서 찾으면 Primary로 기회적 backfill을 예약합니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
package com.ryuqq.cutover.application.fallback;
