package com.ryuqq.cutover.application.repository;

import com.ryuqq.cutover.application.document.DateIndexEntry;
import com.ryuqq.cutover.core.model.CorrelationId;
import com.ryuqq.cutover.core.outcome.Outcome;

import java.time.LocalDate;

/**
 * DateIndex Port.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public interface IndexRepo {

    /**
     * 날짜 인덱스 항목을 조직 문서의 hunt 기준으로 생성하거나 갱신.
     *
     * @param date 인덱스 날짜
     * @param orgSlug 조직 slug
     * @param huntId hunt ID
     * @param correlationId 상관관계 ID
     * @return Ok | Conflict | Unavailable
     * @throws com.ryuqq.cutover.core.spi.RecordValidationException 조직 또는 hunt가 없는 경우
     */
    Outcome<DateIndexEntry> upsertDateEntry(LocalDate date, String orgSlug, String huntId, CorrelationId correlationId);

    default Outcome<DateIndexEntry> upsertDateEntry(LocalDate date, String orgSlug, String huntId) {
        return upsertDateEntry(date, orgSlug, huntId, CorrelationId.newId());
    }
}
