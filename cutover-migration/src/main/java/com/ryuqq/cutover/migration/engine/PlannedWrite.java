package com.ryuqq.cutover.migration.engine;

import com.ryuqq.cutover.core.model.Payload;
import com.ryuqq.cutover.core.model.RecordKey;

/**
 * Primary에 쓸 레코드 하나.
 *
 * @param key 대상 키
 * @param payload 쓸 내용
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public record PlannedWrite(
    RecordKey key,
    Payload payload
) {

    public PlannedWrite {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
    }

    @Override
    public String toString() {
        return "upsert " + key + " (" + payload.getValue().length() + " chars)";
    }
}
