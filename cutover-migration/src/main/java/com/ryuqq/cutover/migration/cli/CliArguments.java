package com.ryuqq.cutover.migration.cli;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@code --flag}, {@code --name=value} 형식의 명령행 인자.
 *
 * <p>허용 목록에 없는 인자, 값이 있는 flag, 값이 없는 option은 모두 {@link UsageException}입니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class CliArguments {

    private static final String PREFIX = "--";

    private final Set<String> flags;
    private final Map<String, String> options;

    private CliArguments(Set<String> flags, Map<String, String> options) {
        this.flags = Collections.unmodifiableSet(flags);
        this.options = Collections.unmodifiableMap(options);
    }

    /**
     * 인자 해석.
     *
     * @param args 명령행 인자
     * @param allowedFlags 값 없는 인자 이름 (예: dry-run)
     * @param allowedOptions 값 있는 인자 이름 (예: concurrency)
     * @return CliArguments
     * @throws UsageException 허용되지 않았거나 형식이 잘못된 인자가 있는 경우
     */
    public static CliArguments parse(String[] args, Set<String> allowedFlags, Set<String> allowedOptions) {
        if (args == null) {
            throw new IllegalArgumentException("args cannot be null");
        }
        Set<String> flags = new HashSet<>();
        Map<String, String> options = new HashMap<>();
        for (String arg : args) {
            if (!arg.startsWith(PREFIX) || arg.length() == PREFIX.length()) {
                throw new UsageException("Unexpected argument: " + arg);
            }
            String body = arg.substring(PREFIX.length());
            int eq = body.indexOf('=');
            if (eq < 0) {
                if (allowedOptions.contains(body)) {
                    throw new UsageException("Option " + arg + " requires a value (" + arg + "=...)");
                }
                if (!allowedFlags.contains(body)) {
                    throw new UsageException("Unknown option: " + arg);
                }
                flags.add(body);
            } else {
                String name = body.substring(0, eq);
                String value = body.substring(eq + 1);
                if (allowedFlags.contains(name)) {
                    throw new UsageException("Flag " + PREFIX + name + " does not take a value");
                }
                if (!allowedOptions.contains(name)) {
                    throw new UsageException("Unknown option: " + PREFIX + name);
                }
                if (value.isBlank()) {
                    throw new UsageException("Option " + PREFIX + name + " requires a value");
                }
                options.put(name, value);
            }
        }
        return new CliArguments(flags, options);
    }

    public boolean hasFlag(String name) {
        return flags.contains(name);
    }

    public Optional<String> option(String name) {
        return Optional.ofNullable(options.get(name));
    }

    /**
     * 정수 option.
     *
     * @throws UsageException 정수가 아닌 경우
     */
    public int intOption(String name, int defaultValue) {
        String value = options.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new UsageException(PREFIX + name + " must be an integer (current: " + value + ")", e);
        }
    }

    /**
     * long option.
     *
     * @throws UsageException 정수가 아닌 경우
     */
    public Optional<Long> longOption(String name) {
        String value = options.get(name);
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new UsageException(PREFIX + name + " must be an integer (current: " + value + ")", e);
        }
    }

    /**
     * 쉼표로 구분된 option (빈 항목 제외).
     */
    public List<String> listOption(String name) {
        String value = options.get(name);
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    }
}
