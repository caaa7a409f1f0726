package com.ryuqq.cutover.migration.cli;

import com.ryuqq.cutover.adapter.inmemory.store.InMemoryStoreAdapter;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.spi.StoreUnavailableException;
import com.ryuqq.cutover.migration.LegacyStoreFixture;
import com.ryuqq.cutover.testkit.store.RecordingStoreAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * MigrationCli, ParityCheckCli 종료 코드 테스트.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
class MigrationCliTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(output, true, StandardCharsets.UTF_8);

    private InMemoryStoreAdapter legacy;
    private InMemoryStoreAdapter primaryStore;
    private RecordingStoreAdapter primary;
    private String checkpointArg;

    @BeforeEach
    void setUp() {
        legacy = new InMemoryStoreAdapter("legacy");
        primaryStore = new InMemoryStoreAdapter("primary");
        primary = new RecordingStoreAdapter(primaryStore);
        checkpointArg = "--checkpoint-path=" + tempDir.resolve("checkpoint.json");
        LegacyStoreFixture.seed(legacy);
    }

    private int migrate(String... args) {
        return new MigrationCli(legacy, primary, out).run(args);
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    // ============================================================
    // MigrationCli
    // ============================================================

    @Test
    void 모두_완료되면_0이다() {
        // when
        int exit = migrate(checkpointArg, "--concurrency=4");

        // then
        assertThat(exit).isEqualTo(MigrationCli.EXIT_OK);
        assertThat(primaryStore.snapshot()).containsKey(RecordKey.organization("globex"));
        assertThat(Files.exists(tempDir.resolve("checkpoint.json"))).isTrue();
        assertThat(printed()).contains("migrated=2");
    }

    @Test
    void dry_run은_계획을_출력하고_쓰지_않는다() {
        // when
        int exit = migrate(checkpointArg, "--dry-run", "--orgs=acme");

        // then
        assertThat(exit).isEqualTo(MigrationCli.EXIT_OK);
        assertThat(primary.putCount()).isZero();
        assertThat(printed())
            .contains("[dry-run] upsert organizations/acme/org")
            .doesNotContain("organizations/globex/org");
        assertThat(Files.exists(tempDir.resolve("checkpoint.json"))).isFalse();
    }

    @Test
    void 건너뛴_조직이_있으면_1이다() {
        // given
        LegacyStoreFixture.putRegistry(legacy, "acme", "ghost");

        // when
        int exit = migrate(checkpointArg);

        // then
        assertThat(exit).isEqualTo(MigrationCli.EXIT_INCOMPLETE);
        assertThat(printed()).contains("skipped ghost");
    }

    @Test
    void 저장소에_접근할_수_없으면_1이다() {
        // given
        primary.failPuts(key -> new StoreUnavailableException("primary", "down"));

        // when
        int exit = migrate(checkpointArg);

        // then
        assertThat(exit).isEqualTo(MigrationCli.EXIT_INCOMPLETE);
        assertThat(printed()).contains("Migration aborted");
    }

    @Test
    void upgrade_schema로_옮기면_같은_플래그의_parity가_MATCH다() {
        // when
        int exit = migrate(checkpointArg, "--upgrade-schema", "--repair");
        int parityExit = new ParityCheckCli(legacy, primary, out).run(new String[]{"--upgrade-schema", "--repair"});

        // then
        assertThat(exit).isEqualTo(MigrationCli.EXIT_OK);
        assertThat(parityExit).isEqualTo(ParityCheckCli.EXIT_OK);
        assertThat(primaryStore.snapshot().get(RecordKey.organization("acme")).getValue())
            .contains("\"schemaVersion\":\"1.2.0\"");
        assertThat(printed()).contains("match=2, mismatch=0");
    }

    @Test
    void 잘못된_인자는_2다() {
        assertThat(migrate("--concurrency=zero")).isEqualTo(MigrationCli.EXIT_USAGE);
        assertThat(migrate("--concurrency=0")).isEqualTo(MigrationCli.EXIT_USAGE);
        assertThat(migrate("--fast")).isEqualTo(MigrationCli.EXIT_USAGE);
        assertThat(migrate("--dry-run=yes")).isEqualTo(MigrationCli.EXIT_USAGE);
        assertThat(printed()).contains("Usage: MigrationCli");
        assertThat(primary.putCount()).isZero();
    }

    // ============================================================
    // ParityCheckCli
    // ============================================================

    @Test
    void parity는_불일치가_있어도_0이다() {
        // when
        int exit = new ParityCheckCli(legacy, primary, out).run(new String[]{"--sample=5", "--seed=7"});

        // then
        assertThat(exit).isEqualTo(ParityCheckCli.EXIT_OK);
        assertThat(printed()).contains("MISSING_IN_PRIMARY").contains("sampled=2");
    }

    @Test
    void parity는_저장소에_접근할_수_없으면_1이다() {
        // given
        primary.failGets(key -> new StoreUnavailableException("primary", "down"));

        // when
        int exit = new ParityCheckCli(legacy, primary, out).run(new String[0]);

        // then
        assertThat(exit).isEqualTo(ParityCheckCli.EXIT_BACKEND);
    }

    @Test
    void parity_잘못된_인자는_2다() {
        ParityCheckCli cli = new ParityCheckCli(legacy, primary, out);

        assertThat(cli.run(new String[]{"--sample=-1"})).isEqualTo(ParityCheckCli.EXIT_USAGE);
        assertThat(cli.run(new String[]{"--seed=abc"})).isEqualTo(ParityCheckCli.EXIT_USAGE);
        assertThat(cli.run(new String[]{"--dry-run"})).isEqualTo(ParityCheckCli.EXIT_USAGE);
    }
}
