package com.ryuqq.cutover.migration.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 자동으로 고칠 수 있는 조직 문서의 구조 결함 복구.
 *
 * <p><strong>복구 항목:</strong></p>
 * <ul>
 *   <li>org가 객체가 아니면 빈 객체로 교체</li>
 *   <li>org.orgSlug가 없으면 키의 slug</li>
 *   <li>org.orgName이 없으면 {@value #UNKNOWN_ORG_NAME}</li>
 *   <li>hunts가 배열이 아니면 빈 배열</li>
 * </ul>
 *
 * <p>키와 다른 orgSlug, hunt의 id/startDate 결함은 데이터를 추측해야 하므로 고치지 않고
 * 검증 단계에서 건너뜁니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class DocumentRepairer {

    public static final String UNKNOWN_ORG_NAME = "Unknown Organization";

    /**
     * 문서 복구 (문서를 직접 수정).
     *
     * @param orgSlug 키의 조직 slug
     * @param document 조직 문서
     * @return 적용한 복구 내역 (결함이 없으면 비어 있음)
     */
    public List<String> repair(String orgSlug, ObjectNode document) {
        if (orgSlug == null || orgSlug.isBlank()) {
            throw new IllegalArgumentException("orgSlug cannot be null or blank");
        }
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        List<String> repairs = new ArrayList<>();

        // 1. org 객체
        ObjectNode org;
        if (document.path("org").isObject()) {
            org = (ObjectNode) document.get("org");
        } else {
            org = document.putObject("org");
            repairs.add("replaced missing org");
        }

        // 2. org 필수 필드
        if (isBlank(org.get("orgSlug"))) {
            org.put("orgSlug", orgSlug);
            repairs.add("set org.orgSlug");
        }
        if (isBlank(org.get("orgName"))) {
            org.put("orgName", UNKNOWN_ORG_NAME);
            repairs.add("set org.orgName");
        }

        // 3. hunts 배열
        if (!document.path("hunts").isArray()) {
            document.putArray("hunts");
            repairs.add("replaced missing hunts");
        }
        return repairs;
    }

    private static boolean isBlank(JsonNode value) {
        return value == null || !value.isTextual() || value.asText().isBlank();
    }
}
