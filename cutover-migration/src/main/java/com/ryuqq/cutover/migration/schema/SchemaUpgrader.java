package com.ryuqq.cutover.migration.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.cutover.core.spi.RecordValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * 조직 문서의 schemaVersion 단계별 업그레이드.
 *
 * <p><strong>업그레이드 경로:</strong></p>
 * <pre>
 * 0.9.0 (schemaVersion 없음) → 1.0.0 → 1.1.0 → 1.2.0
 * </pre>
 *
 * <ul>
 *   <li>0.9.0 → 1.0.0: 최상위 orgSlug/slug, orgName/name을 org로 이동, hunt의 huntId/title/date 이름 정리, status 기본값</li>
 *   <li>1.0.0 → 1.1.0: hunt마다 uploads 요약 추가</li>
 *   <li>1.1.0 → 1.2.0: stop마다 requirements 타입과 assets 기본값</li>
 * </ul>
 *
 * <p>각 단계는 이미 있는 값을 덮어쓰지 않고, 시각 같은 가변 값을 쓰지 않으므로
 * 같은 입력에서 항상 같은 결과를 냅니다. 숫자 schemaVersion은 major 버전으로
 * 해석합니다 ({@code 1} → {@code 1.0.0}).</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class SchemaUpgrader {

    public static final String LATEST_VERSION = "1.2.0";
    public static final String UNVERSIONED = "0.9.0";

    private final Map<String, Step> steps = new LinkedHashMap<>();

    public SchemaUpgrader() {
        register(new Step(UNVERSIONED, "1.0.0", SchemaUpgrader::restructureLegacy));
        register(new Step("1.0.0", "1.1.0", SchemaUpgrader::addUploadSummaries));
        register(new Step("1.1.0", LATEST_VERSION, SchemaUpgrader::addStopRequirements));
    }

    private void register(Step step) {
        steps.put(step.from(), step);
    }

    /**
     * 문서를 최신 버전까지 업그레이드 (문서를 직접 수정).
     *
     * @param document 조직 문서
     * @return 적용한 단계 ("0.9.0 -> 1.0.0" 형식, 이미 최신이면 비어 있음)
     * @throws RecordValidationException 최신 버전까지 가는 경로가 없는 경우
     */
    public List<String> upgrade(ObjectNode document) {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        String version = detectVersion(document);
        List<String> applied = new ArrayList<>();
        while (!LATEST_VERSION.equals(version)) {
            Step step = steps.get(version);
            if (step == null) {
                throw new RecordValidationException("Unsupported schemaVersion",
                    List.of("schemaVersion '" + version + "' has no upgrade path to " + LATEST_VERSION));
            }
            step.apply().accept(document);
            document.put("schemaVersion", step.to());
            applied.add(step.from() + " -> " + step.to());
            version = step.to();
        }
        return applied;
    }

    /**
     * 문서의 schemaVersion 해석.
     *
     * @param document 조직 문서
     * @return 버전 문자열 (없으면 {@link #UNVERSIONED})
     */
    static String detectVersion(JsonNode document) {
        JsonNode version = document.path("schemaVersion");
        if (version.isTextual() && !version.asText().isBlank()) {
            return version.asText();
        }
        if (version.isIntegralNumber()) {
            return version.asInt() + ".0.0";
        }
        return UNVERSIONED;
    }

    // ============================================================
    // 0.9.0 -> 1.0.0
    // ============================================================

    private static void restructureLegacy(ObjectNode document) {
        ObjectNode org = document.path("org").isObject()
            ? (ObjectNode) document.get("org")
            : document.putObject("org");
        moveText(document, org, "orgSlug", "orgSlug");
        moveText(document, org, "slug", "orgSlug");
        moveText(document, org, "orgName", "orgName");
        moveText(document, org, "name", "orgName");

        if (!document.path("hunts").isArray()) {
            return;
        }
        for (JsonNode node : document.get("hunts")) {
            if (!node.isObject()) {
                continue;
            }
            ObjectNode hunt = (ObjectNode) node;
            moveText(hunt, hunt, "huntId", "id");
            moveText(hunt, hunt, "title", "name");
            JsonNode date = hunt.remove("date");
            if (date != null && date.isTextual()) {
                putIfMissing(hunt, "startDate", date.asText());
                putIfMissing(hunt, "endDate", date.asText());
            }
            putIfMissing(hunt, "status", "scheduled");
        }
    }

    /**
     * source의 텍스트 필드를 target으로 이동 (target에 이미 값이 있으면 source 필드만 제거).
     */
    private static void moveText(ObjectNode source, ObjectNode target, String from, String to) {
        JsonNode value = source.get(from);
        if (value == null || !value.isTextual()) {
            return;
        }
        source.remove(from);
        putIfMissing(target, to, value.asText());
    }

    // ============================================================
    // 1.0.0 -> 1.1.0
    // ============================================================

    private static void addUploadSummaries(ObjectNode document) {
        for (ObjectNode hunt : objects(document.path("hunts"))) {
            if (hunt.has("uploads")) {
                continue;
            }
            ObjectNode uploads = hunt.putObject("uploads");
            uploads.putObject("store").put("blobsPrefix", "hunts/" + hunt.path("id").asText("") + "/uploads");
            ObjectNode summary = uploads.putObject("summary");
            summary.put("total", 0);
            summary.put("photos", 0);
            summary.put("videos", 0);
            summary.putNull("lastUploadedAt");
        }
    }

    // ============================================================
    // 1.1.0 -> 1.2.0
    // ============================================================

    private static void addStopRequirements(ObjectNode document) {
        for (ObjectNode hunt : objects(document.path("hunts"))) {
            for (ObjectNode stop : objects(hunt.path("stops"))) {
                if (stop.path("requirements").isArray()) {
                    for (ObjectNode requirement : objects(stop.get("requirements"))) {
                        putIfMissing(requirement, "type", "photo");
                    }
                } else {
                    ArrayNode requirements = stop.putArray("requirements");
                    requirements.addObject()
                        .put("type", "photo")
                        .put("required", true)
                        .put("description", "Photo required");
                }
                if (!stop.has("assets")) {
                    stop.putArray("assets");
                }
            }
        }
    }

    // ============================================================
    // helpers
    // ============================================================

    private static void putIfMissing(ObjectNode node, String field, String value) {
        if (!node.hasNonNull(field)) {
            node.put(field, value);
        }
    }

    private static List<ObjectNode> objects(JsonNode array) {
        List<ObjectNode> objects = new ArrayList<>();
        if (array.isArray()) {
            for (JsonNode element : array) {
                if (element.isObject()) {
                    objects.add((ObjectNode) element);
                }
            }
        }
        return objects;
    }

    private record Step(String from, String to, Consumer<ObjectNode> apply) {
    }
}
