package com.ryuqq.cutover.application.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * 조직 디렉터리 항목 (Registry projection).
 *
 * <p>키는 registry/directory/{orgSlug} 입니다. Registry singleton의
 * {@code organizations[]} 항목을 조직 단위 레코드로 펼친 것입니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"orgSlug", "orgName", "primaryContactEmail", "createdAt", "huntCount"})
public final class OrganizationSummary extends ExtensibleDocument {

    @JsonProperty("orgSlug")
    private final String orgSlug;

    @JsonProperty("orgName")
    private final String orgName;

    @JsonProperty("primaryContactEmail")
    private final String primaryContactEmail;

    @JsonProperty("createdAt")
    private final String createdAt;

    @JsonProperty("huntCount")
    private final int huntCount;

    @JsonCreator
    public OrganizationSummary(
        @JsonProperty("orgSlug") String orgSlug,
        @JsonProperty("orgName") String orgName,
        @JsonProperty("primaryContactEmail") String primaryContactEmail,
        @JsonProperty("createdAt") String createdAt,
        @JsonProperty("huntCount") int huntCount
    ) {
        if (orgSlug == null || orgSlug.isBlank()) {
            throw new IllegalArgumentException("orgSlug cannot be null or blank");
        }
        this.orgSlug = orgSlug;
        this.orgName = orgName;
        this.primaryContactEmail = primaryContactEmail;
        this.createdAt = createdAt;
        this.huntCount = huntCount;
    }

    public String orgSlug() {
        return orgSlug;
    }

    public String orgName() {
        return orgName;
    }

    public String primaryContactEmail() {
        return primaryContactEmail;
    }

    public String createdAt() {
        return createdAt;
    }

    public int huntCount() {
        return huntCount;
    }

    /**
     * huntCount만 변경한 새 인스턴스 생성.
     */
    public OrganizationSummary withHuntCount(int huntCount) {
        return inheritExtras(new OrganizationSummary(orgSlug, orgName, primaryContactEmail, createdAt, huntCount));
    }
}
