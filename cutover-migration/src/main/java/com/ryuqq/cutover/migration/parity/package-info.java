/**
 * Legacy와 Primary 저장소의 조직 문서 비교.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
package com.ryuqq.cutover.migration.parity;
