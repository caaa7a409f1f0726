package com.ryuqq.cutover.application.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Organization 문서.
 *
 * <p>조직 프로필과 hunt 목록을 담습니다. 키는 organizations/{orgSlug}/org 입니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>hunts는 id 기준으로 유일</li>
 *   <li>org.orgSlug는 키와 같고, 생성 후 변경되지 않음 (코덱이 쓰기 전에 확인)</li>
 * </ul>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"schemaVersion", "updatedAt", "org", "hunts"})
public final class Organization extends ExtensibleDocument {

    public static final String CURRENT_SCHEMA_VERSION = "1.0.0";

    @JsonProperty("schemaVersion")
    private final String schemaVersion;

    @JsonProperty("updatedAt")
    private final String updatedAt;

    @JsonProperty("org")
    private final OrgProfile org;

    @JsonProperty("hunts")
    private final List<Hunt> hunts;

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException org가 null이거나 hunt id가 중복된 경우
     */
    @JsonCreator
    public Organization(
        @JsonProperty("schemaVersion") String schemaVersion,
        @JsonProperty("updatedAt") String updatedAt,
        @JsonProperty("org") OrgProfile org,
        @JsonProperty("hunts") List<Hunt> hunts
    ) {
        if (org == null) {
            throw new IllegalArgumentException("org cannot be null");
        }
        List<Hunt> copy = hunts == null ? List.of() : List.copyOf(hunts);
        Set<String> ids = new HashSet<>();
        for (Hunt hunt : copy) {
            if (!ids.add(hunt.id())) {
                throw new IllegalArgumentException("duplicate hunt id: " + hunt.id());
            }
        }
        this.schemaVersion = schemaVersion == null ? CURRENT_SCHEMA_VERSION : schemaVersion;
        this.updatedAt = updatedAt;
        this.org = org;
        this.hunts = copy;
    }

    /**
     * 아직 저장되지 않은 빈 조직 문서.
     *
     * @param orgSlug 조직 slug
     * @return hunt가 없는 Organization
     */
    public static Organization blank(String orgSlug) {
        return new Organization(CURRENT_SCHEMA_VERSION, null, new OrgProfile(orgSlug, null), List.of());
    }

    public String schemaVersion() {
        return schemaVersion;
    }

    public String updatedAt() {
        return updatedAt;
    }

    public OrgProfile org() {
        return org;
    }

    public List<Hunt> hunts() {
        return hunts;
    }

    public String slug() {
        return org.orgSlug();
    }

    /**
     * id로 hunt 조회.
     *
     * @param huntId hunt ID
     * @return hunt (없으면 empty)
     */
    public Optional<Hunt> findHunt(String huntId) {
        return hunts.stream().filter(h -> h.id().equals(huntId)).findFirst();
    }

    /**
     * hunt 추가 또는 같은 id의 hunt 교체.
     *
     * @param hunt 추가할 hunt
     * @return 새 Organization
     */
    public Organization withHunt(Hunt hunt) {
        if (hunt == null) {
            throw new IllegalArgumentException("hunt cannot be null");
        }
        List<Hunt> next = new ArrayList<>(hunts);
        boolean replaced = false;
        for (int i = 0; i < next.size(); i++) {
            if (next.get(i).id().equals(hunt.id())) {
                next.set(i, hunt);
                replaced = true;
                break;
            }
        }
        if (!replaced) {
            next.add(hunt);
        }
        return inheritExtras(new Organization(schemaVersion, updatedAt, org, next));
    }

    /**
     * 프로필만 변경한 새 인스턴스 생성.
     */
    public Organization withProfile(OrgProfile org) {
        return inheritExtras(new Organization(schemaVersion, updatedAt, org, hunts));
    }

    /**
     * updatedAt만 변경한 새 인스턴스 생성.
     */
    public Organization withUpdatedAt(Instant updatedAt) {
        return inheritExtras(new Organization(schemaVersion, updatedAt.toString(), org, hunts));
    }

    @Override
    public String toString() {
        return "Organization{slug=" + slug() + ", hunts=" + hunts.size() + '}';
    }
}
