package com.ryuqq.cutover.migration.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.cutover.application.document.DateIndexEntry;
import com.ryuqq.cutover.application.document.DateIndexEntryCodec;
import com.ryuqq.cutover.application.document.Hunt;
import com.ryuqq.cutover.application.document.Organization;
import com.ryuqq.cutover.application.document.OrganizationCodec;
import com.ryuqq.cutover.application.document.OrganizationSummary;
import com.ryuqq.cutover.application.document.OrganizationSummaryCodec;
import com.ryuqq.cutover.core.model.Payload;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.spi.RecordValidationException;
import com.ryuqq.cutover.migration.schema.DocumentNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Legacy 조직 문서로부터 Primary 쓰기 목록을 만듭니다.
 *
 * <p><strong>조직 하나의 쓰기:</strong></p>
 * <ol>
 *   <li>registry/directory/{slug}: 디렉터리 항목 (huntCount는 실제 hunt 수)</li>
 *   <li>organizations/{slug}/org: Legacy payload (정규화가 바꾼 경우에만 다시 직렬화)</li>
 *   <li>date-index/{startDate}/{slug}:{huntId}: hunt마다 하나</li>
 * </ol>
 *
 * <p>같은 입력에서는 항상 같은 payload를 만들므로 반복 실행해도 결과가 같습니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class WritePlanner {

    private static final Logger log = LoggerFactory.getLogger(WritePlanner.class);

    private final ObjectMapper objectMapper;
    private final OrganizationValidator validator;
    private final OrganizationCodec organizationCodec;
    private final OrganizationSummaryCodec summaryCodec;
    private final DateIndexEntryCodec indexCodec;

    public WritePlanner(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
        this.validator = new OrganizationValidator();
        this.organizationCodec = new OrganizationCodec(objectMapper);
        this.summaryCodec = new OrganizationSummaryCodec(objectMapper);
        this.indexCodec = new DateIndexEntryCodec(objectMapper);
    }

    /**
     * 조직 하나의 쓰기 목록 (정규화 없음).
     *
     * @see #plan(String, Payload, Optional, DocumentNormalizer)
     */
    public List<PlannedWrite> plan(String orgSlug, Payload legacyPayload, Optional<JsonNode> summary) {
        return plan(orgSlug, legacyPayload, summary, DocumentNormalizer.NONE);
    }

    /**
     * 조직 하나의 쓰기 목록.
     *
     * @param orgSlug 조직 slug
     * @param legacyPayload Legacy 조직 문서
     * @param summary Registry 디렉터리 항목 (없으면 문서에서 생성)
     * @param normalizer 검증 전에 적용할 schema 업그레이드/복구
     * @return 쓰기 목록 (디렉터리, 조직, DateIndex 순)
     * @throws RecordValidationException 문서 형태가 잘못된 경우
     */
    public List<PlannedWrite> plan(
        String orgSlug,
        Payload legacyPayload,
        Optional<JsonNode> summary,
        DocumentNormalizer normalizer
    ) {
        if (normalizer == null) {
            throw new IllegalArgumentException("normalizer cannot be null");
        }
        RecordKey orgKey = RecordKey.organization(orgSlug);

        // 1. 정규화
        JsonNode tree;
        try {
            tree = objectMapper.readTree(legacyPayload.getValue());
        } catch (JsonProcessingException e) {
            throw new RecordValidationException("Malformed organization at " + orgKey + ": " + e.getOriginalMessage());
        }
        Payload orgPayload = legacyPayload;
        if (normalizer.isActive() && tree.isObject()) {
            List<String> changes = normalizer.normalize(orgSlug, (ObjectNode) tree);
            if (!changes.isEmpty()) {
                log.info("Organization {} normalized: {}", orgSlug, changes);
                orgPayload = serialize(orgKey, tree);
            }
        }

        // 2. 형태 검증
        List<String> violations = validator.validate(orgSlug, tree);
        if (!violations.isEmpty()) {
            throw new RecordValidationException("Organization " + orgSlug + " failed validation", violations);
        }
        Organization organization = organizationCodec.decode(orgKey, orgPayload);

        // 3. 디렉터리 항목
        List<PlannedWrite> writes = new ArrayList<>();
        RecordKey directoryKey = RecordKey.directoryEntry(orgSlug);
        OrganizationSummary directoryEntry = summary
            .map(node -> summaryCodec.decode(directoryKey, Payload.of(node.toString())))
            .orElseGet(() -> new OrganizationSummary(orgSlug, organization.org().orgName(), null, null, 0))
            .withHuntCount(organization.hunts().size());
        writes.add(new PlannedWrite(directoryKey, summaryCodec.encode(directoryEntry)));

        // 4. 조직 문서
        writes.add(new PlannedWrite(orgKey, orgPayload));

        // 5. hunt별 DateIndex
        for (Hunt hunt : organization.hunts()) {
            DateIndexEntry entry = DateIndexEntry.of(hunt.startLocalDate(), orgSlug, hunt);
            writes.add(new PlannedWrite(
                RecordKey.dateIndex(hunt.startLocalDate(), orgSlug, hunt.id()),
                indexCodec.encode(entry)
            ));
        }
        return writes;
    }

    private Payload serialize(RecordKey orgKey, JsonNode tree) {
        try {
            return Payload.of(objectMapper.writeValueAsString(tree));
        } catch (JsonProcessingException e) {
            throw new RecordValidationException("Cannot serialize normalized organization at " + orgKey
                + ": " + e.getOriginalMessage());
        }
    }
}
