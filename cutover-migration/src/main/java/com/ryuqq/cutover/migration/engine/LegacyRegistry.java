package com.ryuqq.cutover.migration.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.cutover.core.model.Payload;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.spi.RecordValidationException;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Legacy Registry singleton의 조직 디렉터리 뷰.
 *
 * <p>{@code organizations[]} 항목을 slug 순으로 정렬해 보관합니다. slug가 없는 항목은 무시합니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class LegacyRegistry {

    private static final LegacyRegistry EMPTY = new LegacyRegistry(Collections.emptyMap());

    private final Map<String, JsonNode> summaries;

    private LegacyRegistry(Map<String, JsonNode> summaries) {
        this.summaries = summaries;
    }

    /**
     * Registry가 없을 때의 빈 디렉터리.
     */
    public static LegacyRegistry empty() {
        return EMPTY;
    }

    /**
     * Registry payload 해석.
     *
     * @param payload Registry 문서
     * @param objectMapper JSON 파서
     * @return LegacyRegistry
     * @throws RecordValidationException JSON이 아니거나 organizations가 배열이 아닌 경우
     */
    public static LegacyRegistry parse(Payload payload, ObjectMapper objectMapper) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload.getValue());
        } catch (JsonProcessingException e) {
            throw new RecordValidationException("Malformed registry at " + RecordKey.registry() + ": " + e.getOriginalMessage());
        }
        JsonNode organizations = root == null ? null : root.path("organizations");
        if (organizations == null || !organizations.isArray()) {
            throw new RecordValidationException("Registry organizations must be an array");
        }
        Map<String, JsonNode> summaries = new TreeMap<>();
        for (JsonNode entry : organizations) {
            String slug = entry.path("orgSlug").asText("");
            if (!slug.isBlank()) {
                summaries.put(slug, entry);
            }
        }
        return new LegacyRegistry(Collections.unmodifiableMap(summaries));
    }

    /**
     * 정렬된 조직 slug 목록.
     */
    public List<String> organizationSlugs() {
        return List.copyOf(summaries.keySet());
    }

    /**
     * 조직의 디렉터리 항목.
     */
    public Optional<JsonNode> summaryOf(String orgSlug) {
        return Optional.ofNullable(summaries.get(orgSlug));
    }
}
