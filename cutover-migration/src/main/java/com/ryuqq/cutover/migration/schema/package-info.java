/**
 * 조직 문서 schemaVersion 업그레이드와 구조 복구.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
package com.ryuqq.cutover.migration.schema;
