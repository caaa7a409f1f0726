package com.ryuqq.cutover.migration.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.cutover.application.document.Hunt;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Legacy 조직 문서의 형태 검증.
 *
 * <p>문서를 타입으로 바꾸기 전에 JSON 트리 단계에서 검사하므로, 한 번에 모든 위반
 * 사항을 모아 보고합니다.</p>
 *
 * <ul>
 *   <li>org.orgSlug가 키의 slug와 일치</li>
 *   <li>org.orgName 존재</li>
 *   <li>hunts가 배열</li>
 *   <li>각 hunt에 id와 ISO-8601 startDate 존재</li>
 *   <li>hunt id 중복 없음</li>
 * </ul>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class OrganizationValidator {

    /**
     * 문서 검증.
     *
     * @param orgSlug 키의 조직 slug
     * @param document 조직 문서
     * @return 위반 사항 목록 (비어 있으면 유효)
     */
    public List<String> validate(String orgSlug, JsonNode document) {
        List<String> violations = new ArrayList<>();
        if (document == null || !document.isObject()) {
            violations.add("document must be a JSON object");
            return violations;
        }

        JsonNode org = document.path("org");
        if (!org.isObject()) {
            violations.add("org must be an object");
        } else {
            String slug = org.path("orgSlug").asText("");
            if (!slug.equals(orgSlug)) {
                violations.add("org.orgSlug '" + slug + "' does not match key '" + orgSlug + "'");
            }
            if (org.path("orgName").asText("").isBlank()) {
                violations.add("org.orgName is required");
            }
        }

        JsonNode hunts = document.path("hunts");
        if (!hunts.isArray()) {
            violations.add("hunts must be an array");
            return violations;
        }
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < hunts.size(); i++) {
            JsonNode hunt = hunts.get(i);
            String id = hunt.path("id").asText("");
            if (id.isBlank()) {
                violations.add("hunts[" + i + "].id is required");
            } else if (!ids.add(id)) {
                violations.add("hunts[" + i + "].id '" + id + "' is duplicated");
            }
            try {
                Hunt.parseDate(hunt.path("startDate").isTextual() ? hunt.path("startDate").asText() : null);
            } catch (IllegalArgumentException e) {
                violations.add("hunts[" + i + "].startDate: " + e.getMessage());
            }
        }
        return violations;
    }
}
