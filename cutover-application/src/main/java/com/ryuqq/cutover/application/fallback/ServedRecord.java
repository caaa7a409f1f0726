package com.ryuqq.cutover.application.fallback;

import com.ryuqq.cutover.application.routing.StoreRole;
import com.ryuqq.cutover.core.model.StoredRecord;

/**
 * 읽기 결과와 그 레코드를 서비스한 저장소.
 *
 * @param record 저장 레코드
 * @param servedBy 서비스한 저장소 역할
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public record ServedRecord(
    StoredRecord record,
    StoreRole servedBy
) {

    public ServedRecord {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (servedBy == null) {
            throw new IllegalArgumentException("servedBy cannot be null");
        }
    }
}
