package com.ryuqq.cutover.application.document;

/**
 * 날짜별 이벤트 목록의 한 항목.
 *
 * <p>DateIndex 항목과 Organization 문서를 합쳐 만든 읽기 전용 뷰입니다. 저장되지 않습니다.</p>
 *
 * @param key events/{startDate}/{orgSlug}/{huntId}
 * @param orgSlug 조직 slug
 * @param orgName 조직 이름
 * @param eventName hunt 이름
 * @param huntId hunt ID
 * @param startDate 시작일
 * @param endDate 종료일 (null 가능)
 * @param status hunt 상태
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public record EventSummary(
    String key,
    String orgSlug,
    String orgName,
    String eventName,
    String huntId,
    String startDate,
    String endDate,
    String status
) {

    /**
     * 조직 문서와 hunt로부터 생성.
     */
    public static EventSummary of(Organization organization, Hunt hunt) {
        return new EventSummary(
            "events/" + hunt.startDate() + "/" + organization.slug() + "/" + hunt.id(),
            organization.slug(),
            organization.org().orgName(),
            hunt.name(),
            hunt.id(),
            hunt.startDate(),
            hunt.endDate(),
            hunt.status()
        );
    }
}
