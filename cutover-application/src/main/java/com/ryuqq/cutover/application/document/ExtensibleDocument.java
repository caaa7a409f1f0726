package com.ryuqq.cutover.application.document;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 알 수 없는 JSON 필드를 보존하는 문서의 기반 클래스.
 *
 * <p>더 새로운 writer가 추가한 필드를 구버전 reader가 read-modify-write 하더라도
 * 잃어버리지 않도록, 매핑되지 않은 필드를 그대로 보관했다가 직렬화 시 다시 씁니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public abstract class ExtensibleDocument {

    private final Map<String, JsonNode> extras = new LinkedHashMap<>();

    @JsonAnySetter
    protected void putExtra(String name, JsonNode value) {
        extras.put(name, value);
    }

    /**
     * 매핑되지 않은 필드.
     *
     * @return 읽기 전용 필드 맵 (입력 순서 유지)
     */
    @JsonAnyGetter
    public Map<String, JsonNode> extras() {
        return Collections.unmodifiableMap(extras);
    }

    /**
     * 이 문서의 보존 필드를 새 인스턴스로 복사.
     *
     * @param target 복사 대상 (새로 생성된 인스턴스)
     * @return target
     */
    protected <D extends ExtensibleDocument> D inheritExtras(D target) {
        ExtensibleDocument base = target;
        base.extras.putAll(extras);
        return target;
    }
}
