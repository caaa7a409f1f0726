package com.ryuqq.cutover.migration.cli;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CliArguments 테스트.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
class CliArgumentsTest {

    private static final Set<String> FLAGS = Set.of("dry-run", "resume");
    private static final Set<String> OPTIONS = Set.of("concurrency", "orgs", "seed");

    private static CliArguments parse(String... args) {
        return CliArguments.parse(args, FLAGS, OPTIONS);
    }

    @Test
    void flag와_option을_해석한다() {
        // when
        CliArguments arguments = parse("--dry-run", "--concurrency=4", "--orgs=acme, globex,,initech", "--seed=-3");

        // then
        assertThat(arguments.hasFlag("dry-run")).isTrue();
        assertThat(arguments.hasFlag("resume")).isFalse();
        assertThat(arguments.intOption("concurrency", 2)).isEqualTo(4);
        assertThat(arguments.listOption("orgs")).containsExactly("acme", "globex", "initech");
        assertThat(arguments.longOption("seed")).contains(-3L);
    }

    @Test
    void 없는_option은_기본값이다() {
        // when
        CliArguments arguments = parse();

        // then
        assertThat(arguments.intOption("concurrency", 2)).isEqualTo(2);
        assertThat(arguments.listOption("orgs")).isEmpty();
        assertThat(arguments.longOption("seed")).isEmpty();
        assertThat(arguments.option("orgs")).isEmpty();
    }

    @Test
    void 형식이_잘못된_인자는_UsageException이다() {
        assertThatThrownBy(() -> parse("dry-run")).isInstanceOf(UsageException.class);
        assertThatThrownBy(() -> parse("--")).isInstanceOf(UsageException.class);
        assertThatThrownBy(() -> parse("--verbose")).isInstanceOf(UsageException.class)
            .hasMessageContaining("Unknown option");
        assertThatThrownBy(() -> parse("--concurrency")).isInstanceOf(UsageException.class)
            .hasMessageContaining("requires a value");
        assertThatThrownBy(() -> parse("--concurrency=")).isInstanceOf(UsageException.class);
        assertThatThrownBy(() -> parse("--resume=true")).isInstanceOf(UsageException.class)
            .hasMessageContaining("does not take a value");
        assertThatThrownBy(() -> parse("--concurrency=two").intOption("concurrency", 2))
            .isInstanceOf(UsageException.class);
    }
}
