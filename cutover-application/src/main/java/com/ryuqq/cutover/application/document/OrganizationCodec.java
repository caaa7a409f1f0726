package com.ryuqq.cutover.application.document;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.model.Table;
import com.ryuqq.cutover.core.spi.RecordValidationException;

import java.time.Instant;

/**
 * Organization 문서 코덱.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class OrganizationCodec extends JsonDocumentCodec<Organization> {

    public OrganizationCodec(ObjectMapper objectMapper) {
        super(objectMapper, Organization.class);
    }

    @Override
    public Organization blank(RecordKey key) {
        return Organization.blank(key.partitionKey());
    }

    @Override
    public Organization stamp(Organization document, Instant updatedAt) {
        return document.withUpdatedAt(updatedAt);
    }

    /**
     * slug는 키와 같아야 하며 바뀔 수 없습니다.
     */
    @Override
    public void verify(RecordKey key, Organization document) {
        if (key.table() != Table.ORGANIZATIONS) {
            throw new IllegalArgumentException("Not an organization key: " + key);
        }
        if (!key.partitionKey().equals(document.slug())) {
            throw new RecordValidationException(
                "orgSlug '" + document.slug() + "' does not match key " + key);
        }
    }
}
