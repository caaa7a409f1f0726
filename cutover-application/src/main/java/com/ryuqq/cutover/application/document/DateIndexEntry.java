package com.ryuqq.cutover.application.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.LocalDate;

/**
 * 날짜별 hunt 조회 인덱스 항목.
 *
 * <p>키는 date-index/{YYYY-MM-DD}/{orgSlug}:{huntId} 입니다.
 * "오늘 무엇이 열리는가" 조회를 위한 최소 projection이며, 항상 Organization 문서의
 * 실존 hunt를 가리켜야 합니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"date", "orgSlug", "huntId", "huntName", "status", "updatedAt"})
public final class DateIndexEntry extends ExtensibleDocument {

    @JsonProperty("date")
    private final String date;

    @JsonProperty("orgSlug")
    private final String orgSlug;

    @JsonProperty("huntId")
    private final String huntId;

    @JsonProperty("huntName")
    private final String huntName;

    @JsonProperty("status")
    private final String status;

    @JsonProperty("updatedAt")
    private final String updatedAt;

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException date, orgSlug, huntId가 공백인 경우
     */
    @JsonCreator
    public DateIndexEntry(
        @JsonProperty("date") String date,
        @JsonProperty("orgSlug") String orgSlug,
        @JsonProperty("huntId") String huntId,
        @JsonProperty("huntName") String huntName,
        @JsonProperty("status") String status,
        @JsonProperty("updatedAt") String updatedAt
    ) {
        if (date == null || date.isBlank()) {
            throw new IllegalArgumentException("date cannot be null or blank");
        }
        if (orgSlug == null || orgSlug.isBlank()) {
            throw new IllegalArgumentException("orgSlug cannot be null or blank");
        }
        if (huntId == null || huntId.isBlank()) {
            throw new IllegalArgumentException("huntId cannot be null or blank");
        }
        this.date = date;
        this.orgSlug = orgSlug;
        this.huntId = huntId;
        this.huntName = huntName;
        this.status = status;
        this.updatedAt = updatedAt;
    }

    /**
     * hunt로부터 항목 생성.
     *
     * @param date 인덱스 날짜
     * @param orgSlug 조직 slug
     * @param hunt 대상 hunt
     * @return DateIndexEntry
     */
    public static DateIndexEntry of(LocalDate date, String orgSlug, Hunt hunt) {
        return new DateIndexEntry(date.toString(), orgSlug, hunt.id(), hunt.name(), hunt.status(), null);
    }

    public String date() {
        return date;
    }

    public String orgSlug() {
        return orgSlug;
    }

    public String huntId() {
        return huntId;
    }

    public String huntName() {
        return huntName;
    }

    public String status() {
        return status;
    }

    public String updatedAt() {
        return updatedAt;
    }

    /**
     * hunt의 이름/상태로 갱신한 새 인스턴스 생성 (키 필드는 유지).
     */
    public DateIndexEntry refreshedFrom(Hunt hunt) {
        return inheritExtras(new DateIndexEntry(date, orgSlug, huntId, hunt.name(), hunt.status(), updatedAt));
    }

    /**
     * updatedAt만 변경한 새 인스턴스 생성.
     */
    public DateIndexEntry withUpdatedAt(Instant updatedAt) {
        return inheritExtras(new DateIndexEntry(date, orgSlug, huntId, huntName, status, updatedAt.toString()));
    }
}
