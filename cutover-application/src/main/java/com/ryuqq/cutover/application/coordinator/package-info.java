/**
 * Dual-Write Coordinator.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
package com.ryuqq.cutover.application.coordinator;
