/**
 * Migration과 Parity 명령행 진입점.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
package com.ryuqq.cutover.migration.cli;
