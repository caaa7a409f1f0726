package com.ryuqq.cutover.migration.parity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * JSON 트리 비교.
 *
 * <p>무시할 필드는 모든 깊이에서 제거한 뒤 비교하며, 다른 위치를 JSON Pointer
 * ({@code /hunts/0/name}) 형태로 최대 {@code maxPaths}개까지 돌려줍니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
final class JsonTreeDiff {

    private final Set<String> ignoredFields;
    private final int maxPaths;

    JsonTreeDiff(Set<String> ignoredFields, int maxPaths) {
        this.ignoredFields = ignoredFields;
        this.maxPaths = maxPaths;
    }

    /**
     * 두 트리의 차이 경로.
     *
     * @return 다른 위치 목록 (같으면 빈 목록)
     */
    List<String> diff(JsonNode left, JsonNode right) {
        List<String> paths = new ArrayList<>();
        compare("", strip(left), strip(right), paths);
        return paths;
    }

    /**
     * 무시할 필드를 모든 깊이에서 제거한 복사본.
     */
    JsonNode strip(JsonNode node) {
        if (node == null) {
            return null;
        }
        JsonNode copy = node.deepCopy();
        removeIgnored(copy);
        return copy;
    }

    private void removeIgnored(JsonNode node) {
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            object.remove(ignoredFields);
            object.elements().forEachRemaining(this::removeIgnored);
        } else if (node.isArray()) {
            ((ArrayNode) node).elements().forEachRemaining(this::removeIgnored);
        }
    }

    private void compare(String path, JsonNode left, JsonNode right, List<String> paths) {
        if (paths.size() >= maxPaths) {
            return;
        }
        if (left == null || right == null || left.getNodeType() != right.getNodeType()) {
            if (left != right) {
                paths.add(pointer(path));
            }
            return;
        }
        if (left.isObject()) {
            Set<String> names = new TreeSet<>();
            left.fieldNames().forEachRemaining(names::add);
            right.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                compare(path + "/" + escape(name), left.get(name), right.get(name), paths);
            }
        } else if (left.isArray()) {
            int size = Math.max(left.size(), right.size());
            for (int i = 0; i < size; i++) {
                compare(path + "/" + i, left.get(i), right.get(i), paths);
            }
        } else if (!left.equals(right)) {
            paths.add(pointer(path));
        }
    }

    private static String pointer(String path) {
        return path.isEmpty() ? "/" : path;
    }

    // RFC 6901
    private static String escape(String name) {
        return name.replace("~", "~0").replace("/", "~1");
    }
}
