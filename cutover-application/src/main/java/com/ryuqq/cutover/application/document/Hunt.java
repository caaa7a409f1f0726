package com.ryuqq.cutover.application.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * 조직에 속한 hunt (이벤트).
 *
 * <p>식별/일정/상태 필드만 타입으로 다루고, access, scoring, moderation, teams,
 * stops, rules, audit 등 나머지 필드는 {@link #extras()}에 그대로 보존합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>id: 공백 불가</li>
 *   <li>startDate: ISO-8601 날짜 (YYYY-MM-DD, 또는 날짜로 시작하는 date-time)</li>
 * </ul>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "slug", "name", "startDate", "endDate", "status"})
public final class Hunt extends ExtensibleDocument {

    public static final String STATUS_SCHEDULED = "scheduled";

    @JsonProperty("id")
    private final String id;

    @JsonProperty("slug")
    private final String slug;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("startDate")
    private final String startDate;

    @JsonProperty("endDate")
    private final String endDate;

    @JsonProperty("status")
    private final String status;

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException id가 공백이거나 startDate가 ISO 날짜가 아닌 경우
     */
    @JsonCreator
    public Hunt(
        @JsonProperty("id") String id,
        @JsonProperty("slug") String slug,
        @JsonProperty("name") String name,
        @JsonProperty("startDate") String startDate,
        @JsonProperty("endDate") String endDate,
        @JsonProperty("status") String status
    ) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        parseDate(startDate);
        this.id = id;
        this.slug = slug;
        this.name = name;
        this.startDate = startDate;
        this.endDate = endDate;
        this.status = status;
    }

    /**
     * 예정 상태의 hunt 생성.
     *
     * @param id hunt ID (slug로도 사용)
     * @param name 이름
     * @param startDate 시작일
     * @return Hunt
     */
    public static Hunt scheduled(String id, String name, LocalDate startDate) {
        if (startDate == null) {
            throw new IllegalArgumentException("startDate cannot be null");
        }
        return new Hunt(id, id, name, startDate.toString(), startDate.toString(), STATUS_SCHEDULED);
    }

    /**
     * ISO-8601 날짜 문자열을 LocalDate로 변환.
     *
     * <p>date-time 문자열이면 앞의 날짜 부분만 사용합니다.</p>
     *
     * @param value 날짜 문자열
     * @return LocalDate
     * @throws IllegalArgumentException null이거나 ISO 날짜가 아닌 경우
     */
    public static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("startDate cannot be null or blank");
        }
        String datePart = value.length() > 10 && value.charAt(10) == 'T' ? value.substring(0, 10) : value;
        try {
            return LocalDate.parse(datePart);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("startDate must be an ISO-8601 date (current: " + value + ")", e);
        }
    }

    public String id() {
        return id;
    }

    public String slug() {
        return slug;
    }

    public String name() {
        return name;
    }

    public String startDate() {
        return startDate;
    }

    public String endDate() {
        return endDate;
    }

    public String status() {
        return status;
    }

    /**
     * DateIndex 파티션이 되는 시작일.
     */
    public LocalDate startLocalDate() {
        return parseDate(startDate);
    }

    /**
     * status만 변경한 새 인스턴스 생성.
     */
    public Hunt withStatus(String status) {
        return inheritExtras(new Hunt(id, slug, name, startDate, endDate, status));
    }

    /**
     * name만 변경한 새 인스턴스 생성.
     */
    public Hunt withName(String name) {
        return inheritExtras(new Hunt(id, slug, name, startDate, endDate, status));
    }

    @Override
    public String toString() {
        return "Hunt{id=" + id + ", startDate=" + startDate + ", status=" + status + '}';
    }
}
