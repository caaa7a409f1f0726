package com.ryuqq.cutover.migration.schema;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 쓰기 전 조직 문서 정규화 (schema 업그레이드 후 구조 복구).
 *
 * <p>Migration 계획과 Parity 비교가 같은 인스턴스 설정을 사용하면, Parity는 Legacy 문서를
 * Migration이 썼을 형태로 바꾼 뒤 비교합니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class DocumentNormalizer {

    public static final DocumentNormalizer NONE = new DocumentNormalizer(false, false);

    private final boolean upgradeSchema;
    private final boolean repair;
    private final SchemaUpgrader upgrader = new SchemaUpgrader();
    private final DocumentRepairer repairer = new DocumentRepairer();

    /**
     * 생성자.
     *
     * @param upgradeSchema 최신 schemaVersion까지 업그레이드 여부
     * @param repair 구조 결함 복구 여부
     */
    public DocumentNormalizer(boolean upgradeSchema, boolean repair) {
        this.upgradeSchema = upgradeSchema;
        this.repair = repair;
    }

    public boolean isActive() {
        return upgradeSchema || repair;
    }

    /**
     * 문서 정규화 (문서를 직접 수정).
     *
     * @param orgSlug 키의 조직 slug
     * @param document 조직 문서
     * @return 적용한 변경 내역 (변경이 없으면 비어 있음)
     * @throws com.ryuqq.cutover.core.spi.RecordValidationException 업그레이드 경로가 없는 경우
     */
    public List<String> normalize(String orgSlug, ObjectNode document) {
        List<String> changes = new ArrayList<>();
        if (upgradeSchema) {
            upgrader.upgrade(document).forEach(step -> changes.add("upgraded " + step));
        }
        if (repair) {
            changes.addAll(repairer.repair(orgSlug, document));
        }
        return changes;
    }
}
