package com.ryuqq.cutover.migration.cli;

/**
 * 잘못된 명령행 인자.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public class UsageException extends RuntimeException {

    public UsageException(String message) {
        super(message);
    }

    public UsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
