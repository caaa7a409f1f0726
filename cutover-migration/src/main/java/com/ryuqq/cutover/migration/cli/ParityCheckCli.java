package com.ryuqq.cutover.migration.cli;

import com.ryuqq.cutover.application.config.ConfigValues;
import com.ryuqq.cutover.core.spi.StoreAdapter;
import com.ryuqq.cutover.core.spi.StoreException;
import com.ryuqq.cutover.migration.parity.ParityChecker;
import com.ryuqq.cutover.migration.parity.ParityConfig;
import com.ryuqq.cutover.migration.parity.ParityReport;
import com.ryuqq.cutover.migration.parity.ParityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Set;

/**
 * Parity 명령행 도구.
 *
 * <pre>
 * ParityCheckCli [--sample=N] [--seed=LONG] [--upgrade-schema] [--repair]
 * </pre>
 *
 * <p>불일치는 출력만 하고 종료 코드에 반영하지 않습니다. 저장소에 접근할 수 없으면 1,
 * 잘못된 인자는 2입니다. Migration을 {@code --upgrade-schema}/{@code --repair}로 실행했다면
 * 같은 플래그로 비교합니다.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
public final class ParityCheckCli {

    private static final Logger log = LoggerFactory.getLogger(ParityCheckCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_BACKEND = 1;
    public static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage: ParityCheckCli [--sample=N] [--seed=LONG] [--upgrade-schema] [--repair]";

    private final ParityChecker checker;
    private final PrintStream out;

    public ParityCheckCli(StoreAdapter legacy, StoreAdapter primary, PrintStream out) {
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        this.checker = new ParityChecker(legacy, primary);
        this.out = out;
    }

    public static void main(String[] args) {
        StoreBootstrap stores = StoreBootstrap.from(ConfigValues.load());
        System.exit(new ParityCheckCli(stores.legacy(), stores.primary(), System.out).run(args));
    }

    /**
     * 인자 해석 후 실행.
     *
     * @param args 명령행 인자
     * @return 종료 코드
     */
    public int run(String[] args) {
        ParityConfig config;
        try {
            CliArguments arguments = CliArguments.parse(args,
                Set.of("upgrade-schema", "repair"), Set.of("sample", "seed"));
            config = new ParityConfig()
                .withSampleSize(arguments.intOption("sample", ParityConfig.DEFAULT_SAMPLE_SIZE))
                .withSeed(arguments.longOption("seed").orElse(null))
                .withUpgradeSchema(arguments.hasFlag("upgrade-schema"))
                .withRepair(arguments.hasFlag("repair"));
        } catch (UsageException | IllegalArgumentException e) {
            out.println(e.getMessage());
            out.println(USAGE);
            return EXIT_USAGE;
        }

        ParityReport report;
        try {
            report = checker.check(config);
        } catch (StoreException e) {
            log.error("Parity check aborted", e);
            out.println("Parity check aborted: " + e.getMessage());
            return EXIT_BACKEND;
        }

        for (ParityResult result : report.results()) {
            out.println(result);
        }
        out.println(report.summary());
        return EXIT_OK;
    }
}
