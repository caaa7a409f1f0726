package com.ryuqq.cutover.application.repository;

import com.ryuqq.cutover.application.document.EventSummary;
import com.ryuqq.cutover.core.model.CorrelationId;

import java.time.LocalDate;
import java.util.List;

/**
 * 날짜별 이벤트 조회 Port.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public interface EventRepo {

    /**
     * 해당 날짜에 시작하는 이벤트 목록.
     *
     * <p>조직 이름, 이벤트 이름 순으로 정렬됩니다. 인덱스에는 있지만 조직 문서에서
     * 사라진 hunt는 경고 로그와 함께 제외됩니다.</p>
     *
     * @param date 날짜
     * @param correlationId 상관관계 ID
     * @return 이벤트 목록 (없으면 빈 목록)
     */
    List<EventSummary> listForDate(LocalDate date, CorrelationId correlationId);

    default List<EventSummary> listForDate(LocalDate date) {
        return listForDate(date, CorrelationId.newId());
    }
}
