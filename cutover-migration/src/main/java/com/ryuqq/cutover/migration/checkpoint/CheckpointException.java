package com.ryuqq.cutover.migration.checkpoint;

/**
 * 체크포인트 파일을 읽거나 쓸 수 없을 때 발생.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public class CheckpointException extends RuntimeException {

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
