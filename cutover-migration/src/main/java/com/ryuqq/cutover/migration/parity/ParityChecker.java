package com.ryuqq.cutover.migration.parity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.cutover.application.document.Documents;
import com.ryuqq.cutover.application.document.Hunt;
import com.ryuqq.cutover.core.model.CorrelationId;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.model.StoredRecord;
import com.ryuqq.cutover.core.spi.CorrelationScope;
import com.ryuqq.cutover.core.spi.RecordValidationException;
import com.ryuqq.cutover.core.spi.StoreAdapter;
import com.ryuqq.cutover.migration.engine.LegacyRegistry;
import com.ryuqq.cutover.migration.schema.DocumentNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Parity Checker.
 *
 * <p>Legacy Registry에서 조직을 샘플링해 두 저장소의 조직 문서를 비교합니다.</p>
 *
 * <p><strong>비교 규칙:</strong></p>
 * <ul>
 *   <li>무시할 필드(기본 updatedAt, etag)는 모든 깊이에서 제거 후 JSON 트리 비교</li>
 *   <li>Legacy hunt마다 Primary에 DateIndex 항목이 있는지 확인</li>
 *   <li>불일치는 결과에만 기록하며, 저장소 장애만 예외로 전파</li>
 * </ul>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class ParityChecker {

    private static final Logger log = LoggerFactory.getLogger(ParityChecker.class);

    private final StoreAdapter legacy;
    private final StoreAdapter primary;
    private final ObjectMapper objectMapper;

    public ParityChecker(StoreAdapter legacy, StoreAdapter primary) {
        this(legacy, primary, Documents.objectMapper());
    }

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public ParityChecker(StoreAdapter legacy, StoreAdapter primary, ObjectMapper objectMapper) {
        if (legacy == null) {
            throw new IllegalArgumentException("legacy cannot be null");
        }
        if (primary == null) {
            throw new IllegalArgumentException("primary cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.legacy = legacy;
        this.primary = primary;
        this.objectMapper = objectMapper;
    }

    /**
     * 샘플 비교 실행.
     *
     * @param config 비교 설정
     * @return 조직별 결과
     * @throws com.ryuqq.cutover.core.spi.StoreUnavailableException 저장소에 접근할 수 없는 경우
     * @throws com.ryuqq.cutover.core.spi.RecordValidationException Legacy Registry 형식이 잘못된 경우
     */
    public ParityReport check(ParityConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        CorrelationId correlationId = CorrelationId.newId();
        try (CorrelationScope ignored = CorrelationScope.open(correlationId)) {
            List<String> sample = sample(loadSlugs(correlationId), config);
            log.info("Parity check started: legacy={}, primary={}, sample={}",
                legacy.name(), primary.name(), sample.size());

            JsonTreeDiff diff = new JsonTreeDiff(config.ignoredFields(), config.maxDiffPaths());
            DocumentNormalizer normalizer = config.normalizer();
            List<ParityResult> results = new ArrayList<>();
            for (String slug : sample) {
                ParityResult result = compare(slug, diff, normalizer, config.maxDiffPaths(), correlationId);
                if (!result.isMatch()) {
                    log.warn("Parity {}", result);
                }
                results.add(result);
            }

            ParityReport report = new ParityReport(results);
            log.info("Parity check finished: {}", report.summary());
            return report;
        }
    }

    private List<String> loadSlugs(CorrelationId correlationId) {
        return legacy.get(RecordKey.registry(), correlationId)
            .map(record -> LegacyRegistry.parse(record.payload(), objectMapper))
            .orElseGet(() -> {
                log.warn("Legacy registry {} not found, nothing to compare", RecordKey.registry());
                return LegacyRegistry.empty();
            })
            .organizationSlugs();
    }

    private static List<String> sample(List<String> slugs, ParityConfig config) {
        List<String> candidates = new ArrayList<>(slugs);
        if (config.seed() != null) {
            Collections.shuffle(candidates, new Random(config.seed()));
        }
        return List.copyOf(candidates.subList(0, Math.min(config.sampleSize(), candidates.size())));
    }

    private ParityResult compare(
        String slug,
        JsonTreeDiff diff,
        DocumentNormalizer normalizer,
        int maxPaths,
        CorrelationId correlationId
    ) {
        RecordKey key = RecordKey.organization(slug);
        Optional<StoredRecord> legacyRecord = legacy.get(key, correlationId);
        Optional<StoredRecord> primaryRecord = primary.get(key, correlationId);

        if (legacyRecord.isEmpty()) {
            return ParityResult.of(slug, ParityStatus.MISSING_IN_LEGACY);
        }
        if (primaryRecord.isEmpty()) {
            return ParityResult.of(slug, ParityStatus.MISSING_IN_PRIMARY);
        }

        JsonNode legacyTree = readTree(legacyRecord.get());
        JsonNode primaryTree = readTree(primaryRecord.get());
        if (legacyTree == null || primaryTree == null) {
            return new ParityResult(slug, ParityStatus.MISMATCH, List.of("/"));
        }

        // 1. Migration이 썼을 형태로 Legacy 문서 정규화
        if (normalizer.isActive() && legacyTree.isObject()) {
            try {
                normalizer.normalize(slug, (ObjectNode) legacyTree);
            } catch (RecordValidationException e) {
                log.warn("Organization {} cannot be normalized, comparing as stored: {}", slug, e.getViolations());
            }
        }

        // 2. 문서 비교
        List<String> paths = new ArrayList<>(diff.diff(legacyTree, primaryTree));

        // 3. hunt별 DateIndex 확인
        for (JsonNode hunt : legacyTree.path("hunts")) {
            if (paths.size() >= maxPaths) {
                break;
            }
            String huntId = hunt.path("id").asText("");
            Optional<LocalDate> startDate = startDateOf(hunt);
            if (huntId.isBlank() || startDate.isEmpty()) {
                continue;
            }
            RecordKey entryKey = RecordKey.dateIndex(startDate.get(), slug, huntId);
            if (primary.get(entryKey, correlationId).isEmpty()) {
                paths.add(entryKey.toString());
            }
        }

        return paths.isEmpty()
            ? ParityResult.of(slug, ParityStatus.MATCH)
            : new ParityResult(slug, ParityStatus.MISMATCH, paths);
    }

    private JsonNode readTree(StoredRecord record) {
        try {
            return objectMapper.readTree(record.payload().getValue());
        } catch (JsonProcessingException e) {
            log.warn("Malformed document {}: {}", record.key(), e.getOriginalMessage());
            return null;
        }
    }

    private static Optional<LocalDate> startDateOf(JsonNode hunt) {
        try {
            return Optional.of(Hunt.parseDate(hunt.path("startDate").asText(null)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
