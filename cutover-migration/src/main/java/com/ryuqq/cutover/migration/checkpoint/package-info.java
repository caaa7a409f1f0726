/**
 * Migration 체크포인트.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
package com.ryuqq.cutover.migration.checkpoint;
