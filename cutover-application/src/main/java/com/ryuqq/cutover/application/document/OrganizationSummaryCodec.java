package com.ryuqq.cutover.application.document;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.cutover.core.model.RecordKey;

import java.time.Instant;

/**
 * 조직 디렉터리 항목 코덱.
 *
 * <p>디렉터리 항목에는 updatedAt 필드가 없으므로 stamp는 문서를 그대로 반환합니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class OrganizationSummaryCodec extends JsonDocumentCodec<OrganizationSummary> {

    public OrganizationSummaryCodec(ObjectMapper objectMapper) {
        super(objectMapper, OrganizationSummary.class);
    }

    @Override
    public OrganizationSummary blank(RecordKey key) {
        return new OrganizationSummary(key.rowKey(), null, null, null, 0);
    }

    @Override
    public OrganizationSummary stamp(OrganizationSummary document, Instant updatedAt) {
        return document;
    }
}
