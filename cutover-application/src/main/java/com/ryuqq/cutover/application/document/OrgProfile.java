package com.ryuqq.cutover.application.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * 조직 프로필 (Organization 문서의 {@code org} 필드).
 *
 * <p>contacts, settings 등은 {@link #extras()}로 보존됩니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"orgSlug", "orgName"})
public final class OrgProfile extends ExtensibleDocument {

    @JsonProperty("orgSlug")
    private final String orgSlug;

    @JsonProperty("orgName")
    private final String orgName;

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException orgSlug가 공백인 경우
     */
    @JsonCreator
    public OrgProfile(
        @JsonProperty("orgSlug") String orgSlug,
        @JsonProperty("orgName") String orgName
    ) {
        if (orgSlug == null || orgSlug.isBlank()) {
            throw new IllegalArgumentException("orgSlug cannot be null or blank");
        }
        this.orgSlug = orgSlug;
        this.orgName = orgName;
    }

    public String orgSlug() {
        return orgSlug;
    }

    public String orgName() {
        return orgName;
    }

    /**
     * orgName만 변경한 새 인스턴스 생성.
     */
    public OrgProfile withOrgName(String orgName) {
        return inheritExtras(new OrgProfile(orgSlug, orgName));
    }
}
