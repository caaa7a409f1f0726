package com.ryuqq.cutover.migration.cli;

import com.ryuqq.cutover.application.config.ConfigValues;
import com.ryuqq.cutover.core.spi.StoreAdapter;
import com.ryuqq.cutover.core.spi.StoreException;
import com.ryuqq.cutover.migration.checkpoint.CheckpointException;
import com.ryuqq.cutover.migration.checkpoint.FileCheckpointStore;
import com.ryuqq.cutover.migration.engine.MigrationConfig;
import com.ryuqq.cutover.migration.engine.MigrationEngine;
import com.ryuqq.cutover.migration.engine.MigrationReport;
import com.ryuqq.cutover.migration.engine.PlannedWrite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Migration 명령행 도구.
 *
 * <pre>
 * MigrationCli [--dry-run] [--resume] [--upgrade-schema] [--repair] [--checkpoint-path=PATH]
 *              [--concurrency=N] [--orgs=a,b]
 * </pre>
 *
 * <p><strong>종료 코드:</strong></p>
 * <ul>
 *   <li>0: 모든 조직 완료</li>
 *   <li>1: 건너뛰거나 실패한 조직이 있거나, 취소되었거나, 저장소에 접근할 수 없음</li>
 *   <li>2: 잘못된 인자</li>
 * </ul>
 *
 * <p>SIGINT/SIGTERM을 받으면 새 조직 시작을 멈추고 진행 중인 조직이 체크포인트에
 * 기록될 때까지 기다립니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class MigrationCli {

    private static final Logger log = LoggerFactory.getLogger(MigrationCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_INCOMPLETE = 1;
    public static final int EXIT_USAGE = 2;

    public static final String DEFAULT_CHECKPOINT_PATH = "migration-checkpoint.json";

    private static final long SHUTDOWN_WAIT_SECONDS = 60;

    private static final String USAGE =
        "Usage: MigrationCli [--dry-run] [--resume] [--upgrade-schema] [--repair] [--checkpoint-path=PATH]"
            + " [--concurrency=N] [--orgs=a,b]";

    private final StoreAdapter legacy;
    private final StoreAdapter primary;
    private final PrintStream out;
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile MigrationEngine engine;

    /**
     * 생성자.
     *
     * @param legacy 원본 저장소
     * @param primary 대상 저장소
     * @param out 결과 출력
     */
    public MigrationCli(StoreAdapter legacy, StoreAdapter primary, PrintStream out) {
        if (legacy == null) {
            throw new IllegalArgumentException("legacy cannot be null");
        }
        if (primary == null) {
            throw new IllegalArgumentException("primary cannot be null");
        }
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        this.legacy = legacy;
        this.primary = primary;
        this.out = out;
    }

    public static void main(String[] args) {
        StoreBootstrap stores = StoreBootstrap.from(ConfigValues.load());
        MigrationCli cli = new MigrationCli(stores.legacy(), stores.primary(), System.out);
        Runtime.getRuntime().addShutdownHook(new Thread(cli::cancelAndWait, "cutover-migration-shutdown"));
        System.exit(cli.run(args));
    }

    /**
     * 인자 해석 후 실행.
     *
     * @param args 명령행 인자
     * @return 종료 코드
     */
    public int run(String[] args) {
        try {
            // 1. 인자 해석
            MigrationConfig config;
            Path checkpointPath;
            try {
                CliArguments arguments = CliArguments.parse(args,
                    Set.of("dry-run", "resume", "upgrade-schema", "repair"),
                    Set.of("checkpoint-path", "concurrency", "orgs"));
                config = new MigrationConfig(
                    arguments.hasFlag("dry-run"),
                    arguments.hasFlag("resume"),
                    arguments.intOption("concurrency", MigrationConfig.DEFAULT_CONCURRENCY),
                    arguments.listOption("orgs"),
                    arguments.hasFlag("upgrade-schema"),
                    arguments.hasFlag("repair")
                );
                checkpointPath = Path.of(arguments.option("checkpoint-path").orElse(DEFAULT_CHECKPOINT_PATH));
            } catch (UsageException | IllegalArgumentException e) {
                out.println(e.getMessage());
                out.println(USAGE);
                return EXIT_USAGE;
            }

            // 2. 실행
            engine = new MigrationEngine(legacy, primary, new FileCheckpointStore(checkpointPath));
            MigrationReport report;
            try {
                report = engine.run(config);
            } catch (StoreException | CheckpointException e) {
                log.error("Migration aborted", e);
                out.println("Migration aborted: " + e.getMessage());
                return EXIT_INCOMPLETE;
            }

            // 3. 결과 출력
            print(report);
            return report.isSuccess() ? EXIT_OK : EXIT_INCOMPLETE;
        } finally {
            finished.countDown();
        }
    }

    /**
     * 진행 중인 실행 취소 후 종료 대기 (shutdown hook).
     */
    void cancelAndWait() {
        MigrationEngine current = engine;
        if (current == null || finished.getCount() == 0) {
            return;
        }
        current.cancel();
        try {
            if (!finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Migration did not finish within {}s after cancel", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void print(MigrationReport report) {
        if (report.dryRun()) {
            for (PlannedWrite write : report.plannedWrites()) {
                out.println("[dry-run] " + write);
            }
        }
        report.skipped().forEach((slug, reason) -> out.println("skipped " + slug + ": " + reason));
        report.failed().forEach((slug, reason) -> out.println("failed " + slug + ": " + reason));
        if (!report.notDispatched().isEmpty()) {
            out.println("not started (cancelled): " + String.join(", ", report.notDispatched()));
        }
        out.println(report.summary());
    }
}
