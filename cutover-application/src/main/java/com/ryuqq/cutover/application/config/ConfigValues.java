package com.ryuqq.cutover.application.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * 계층형 설정값.
 *
 * <p>여러 소스를 순서대로 겹치며, 뒤의 소스가 앞의 소스를 덮어씁니다.
 * 기본 구성({@link #load()})의 순서는 다음과 같습니다:</p>
 * <ol>
 *   <li>클래스패스의 {@code cutover.properties}</li>
 *   <li>환경 변수</li>
 *   <li>JVM 시스템 프로퍼티 ({@code -DPRIMARY_STORE_ENABLED=true})</li>
 * </ol>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class ConfigValues {

    public static final String PROPERTIES_RESOURCE = "cutover.properties";

    private final Map<String, String> values;

    private ConfigValues(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * 주어진 소스를 순서대로 겹쳐 생성.
     *
     * @param layers 설정 소스 (뒤가 우선)
     * @return ConfigValues
     */
    @SafeVarargs
    public static ConfigValues of(Map<String, String>... layers) {
        Map<String, String> merged = new HashMap<>();
        for (Map<String, String> layer : layers) {
            if (layer != null) {
                merged.putAll(layer);
            }
        }
        return new ConfigValues(merged);
    }

    /**
     * 기본 소스(properties 파일, 환경 변수, 시스템 프로퍼티)에서 읽기.
     *
     * @return ConfigValues
     * @throws UncheckedIOException properties 파일을 읽을 수 없는 경우
     */
    public static ConfigValues load() {
        return of(classpathProperties(PROPERTIES_RESOURCE), System.getenv(), toMap(System.getProperties()));
    }

    /**
     * 값 조회.
     *
     * @param name 키
     * @return 값 (없거나 공백이면 empty)
     */
    public Optional<String> get(String name) {
        String value = values.get(name);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    /**
     * boolean 값 조회.
     *
     * <p>true/false, 1/0, yes/no, on/off (대소문자 무시)를 허용합니다.</p>
     *
     * @throws IllegalArgumentException 해석할 수 없는 값인 경우
     */
    public boolean getBoolean(String name, boolean defaultValue) {
        Optional<String> value = get(name);
        if (value.isEmpty()) {
            return defaultValue;
        }
        switch (value.get().toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
            case "yes":
            case "on":
                return true;
            case "false":
            case "0":
            case "no":
            case "off":
                return false;
            default:
                throw new IllegalArgumentException(
                    name + " must be a boolean (current: " + value.get() + ")"
                );
        }
    }

    /**
     * long 값 조회.
     *
     * @throws IllegalArgumentException 숫자가 아닌 경우
     */
    public long getLong(String name, long defaultValue) {
        Optional<String> value = get(name);
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.get());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number (current: " + value.get() + ")", e);
        }
    }

    static Map<String, String> classpathProperties(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = ConfigValues.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                return Map.of();
            }
            Properties properties = new Properties();
            properties.load(in);
            return toMap(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    private static Map<String, String> toMap(Properties properties) {
        Map<String, String> map = new HashMap<>();
        for (String name : properties.stringPropertyNames()) {
            map.put(name, properties.getProperty(name));
        }
        return map;
    }
}
