package com.ryuqq.cutover.application.document;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.spi.RecordValidationException;

import java.time.Instant;

/**
 * DateIndex 항목 코덱.
 *
 * <p>row key는 {orgSlug}:{huntId} 형식입니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class DateIndexEntryCodec extends JsonDocumentCodec<DateIndexEntry> {

    public DateIndexEntryCodec(ObjectMapper objectMapper) {
        super(objectMapper, DateIndexEntry.class);
    }

    @Override
    public DateIndexEntry blank(RecordKey key) {
        String rowKey = key.rowKey();
        int separator = rowKey.indexOf(':');
        if (separator <= 0 || separator == rowKey.length() - 1) {
            throw new RecordValidationException("Malformed date index row key: " + key);
        }
        return new DateIndexEntry(
            key.partitionKey(),
            rowKey.substring(0, separator),
            rowKey.substring(separator + 1),
            null,
            null,
            null
        );
    }

    @Override
    public DateIndexEntry stamp(DateIndexEntry document, Instant updatedAt) {
        return document.withUpdatedAt(updatedAt);
    }

    @Override
    public void verify(RecordKey key, DateIndexEntry document) {
        if (!key.partitionKey().equals(document.date())
            || !key.rowKey().equals(document.orgSlug() + ":" + document.huntId())) {
            throw new RecordValidationException("Date index entry does not match key " + key);
        }
    }
}
