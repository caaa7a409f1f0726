package com.ryuqq.cutover.migration.parity;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.cutover.adapter.inmemory.store.InMemoryStoreAdapter;
import com.ryuqq.cutover.application.document.Documents;
import com.ryuqq.cutover.core.model.CorrelationId;
import com.ryuqq.cutover.core.model.ExpectedVersion;
import com.ryuqq.cutover.core.model.Payload;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.spi.StoreUnavailableException;
import com.ryuqq.cutover.migration.LegacyStoreFixture;
import com.ryuqq.cutover.migration.checkpoint.FileCheckpointStore;
import com.ryuqq.cutover.migration.engine.MigrationConfig;
import com.ryuqq.cutover.migration.engine.MigrationEngine;
import com.ryuqq.cutover.testkit.store.RecordingStoreAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static com.ryuqq.cutover.migration.LegacyStoreFixture.ACME;
import static com.ryuqq.cutover.migration.LegacyStoreFixture.GLOBEX;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ParityChecker 테스트.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
class ParityCheckerTest {

    @TempDir
    Path tempDir;

    private final CorrelationId cid = CorrelationId.of("parity-test");

    private InMemoryStoreAdapter legacy;
    private RecordingStoreAdapter primary;
    private ParityChecker checker;

    @BeforeEach
    void setUp() {
        legacy = new InMemoryStoreAdapter("legacy");
        primary = new RecordingStoreAdapter(new InMemoryStoreAdapter("primary"));
        LegacyStoreFixture.seed(legacy);
        checker = new ParityChecker(legacy, primary);
    }

    private void migrate() {
        new MigrationEngine(legacy, primary, new FileCheckpointStore(tempDir.resolve("checkpoint.json")))
            .run(new MigrationConfig());
    }

    private void overwritePrimary(String slug, String document) {
        primary.getDelegate().put(RecordKey.organization(slug), Payload.of(document), ExpectedVersion.any(), cid);
    }

    private ParityResult resultFor(ParityReport report, String slug) {
        return report.results().stream().filter(r -> r.orgSlug().equals(slug)).findFirst().orElseThrow();
    }

    @Test
    void Migration_직후에는_모두_MATCH다() {
        // given
        migrate();

        // when
        ParityReport report = checker.check(new ParityConfig());

        // then
        assertThat(report.allMatch()).isTrue();
        assertThat(report.results()).extracting(ParityResult::orgSlug).containsExactly(ACME, GLOBEX);
        assertThat(report.counts().get(ParityStatus.MATCH)).isEqualTo(2);
    }

    @Test
    void updatedAt만_다르면_MATCH다() {
        // given
        migrate();
        overwritePrimary(ACME, LegacyStoreFixture.acmeDocument().replace("2024-04-02T10:00:00Z", "2024-06-01T00:00:00Z"));

        // when
        ParityReport report = checker.check(new ParityConfig());

        // then
        assertThat(resultFor(report, ACME).status()).isEqualTo(ParityStatus.MATCH);
    }

    @Test
    void 내용이_다르면_MISMATCH와_JSON_Pointer_경로를_보고한다() {
        // given
        migrate();
        overwritePrimary(ACME, LegacyStoreFixture.acmeDocument()
            .replace("\"orgName\":\"ACME\"", "\"orgName\":\"Acme Renamed\"")
            .replace("Under the bridge", "Behind the library"));

        // when
        ParityResult result = resultFor(checker.check(new ParityConfig()), ACME);

        // then
        assertThat(result.status()).isEqualTo(ParityStatus.MISMATCH);
        assertThat(result.diffPaths()).containsExactly("/hunts/0/stops/0/clue", "/org/orgName");
    }

    @Test
    void 무시할_필드는_설정할_수_있다() {
        // given
        migrate();
        overwritePrimary(ACME, LegacyStoreFixture.acmeDocument().replace("\"orgName\":\"ACME\"", "\"orgName\":\"Other\""));
        ParityConfig config = new ParityConfig().withIgnoredFields(Set.of("updatedAt", "orgName"));

        // when
        ParityResult result = resultFor(checker.check(config), ACME);

        // then
        assertThat(result.isMatch()).isTrue();
    }

    @Test
    void schema_업그레이드로_옮긴_문서는_같은_설정으로_비교하면_MATCH다() {
        // given
        new MigrationEngine(legacy, primary, new FileCheckpointStore(tempDir.resolve("checkpoint.json")))
            .run(new MigrationConfig().withUpgradeSchema(true));

        // when
        ParityReport upgraded = checker.check(new ParityConfig().withUpgradeSchema(true));
        ParityReport plain = checker.check(new ParityConfig());

        // then
        assertThat(upgraded.allMatch()).isTrue();
        assertThat(resultFor(plain, ACME).status()).isEqualTo(ParityStatus.MISMATCH);
        assertThat(resultFor(plain, ACME).diffPaths()).contains("/schemaVersion");
    }

    @Test
    void Primary에_없으면_MISSING_IN_PRIMARY다() {
        // when
        ParityReport report = checker.check(new ParityConfig());

        // then
        assertThat(report.results()).extracting(ParityResult::status)
            .containsOnly(ParityStatus.MISSING_IN_PRIMARY);
    }

    @Test
    void Registry에_있지만_Legacy_문서가_없으면_MISSING_IN_LEGACY다() {
        // given
        LegacyStoreFixture.putRegistry(legacy, ACME, "ghost");

        // when
        ParityReport report = checker.check(new ParityConfig());

        // then
        assertThat(resultFor(report, "ghost").status()).isEqualTo(ParityStatus.MISSING_IN_LEGACY);
    }

    @Test
    void DateIndex_항목이_없으면_MISMATCH다() {
        // given
        legacy.put(RecordKey.registry(), Payload.of("{\"organizations\":[{\"orgSlug\":\"globex\"}]}"),
            ExpectedVersion.any(), cid);
        overwritePrimary(GLOBEX, LegacyStoreFixture.globexDocument());

        // when
        ParityResult result = resultFor(checker.check(new ParityConfig()), GLOBEX);

        // then
        assertThat(result.status()).isEqualTo(ParityStatus.MISMATCH);
        assertThat(result.diffPaths()).containsExactly(
            RecordKey.dateIndex(LocalDate.of(2024, 5, 1), GLOBEX, "launch").toString());
    }

    @Test
    void 샘플_크기와_seed를_따른다() {
        // given
        LegacyStoreFixture.putRegistry(legacy, "a", "b", "c", "d", "e", "f");
        ParityConfig config = new ParityConfig().withSampleSize(3).withSeed(42L);

        // when
        ParityReport first = checker.check(config);
        ParityReport second = checker.check(config);
        ParityReport sorted = checker.check(new ParityConfig().withSampleSize(3));

        // then
        assertThat(first.results()).hasSize(3);
        assertThat(first.results()).extracting(ParityResult::orgSlug)
            .containsExactlyElementsOf(second.results().stream().map(ParityResult::orgSlug).toList());
        assertThat(sorted.results()).extracting(ParityResult::orgSlug).containsExactly("a", "b", "c");
    }

    @Test
    void 저장소_장애는_예외로_전파된다() {
        // given
        primary.failGets(key -> new StoreUnavailableException("primary", "down"));

        // when & then
        assertThatThrownBy(() -> checker.check(new ParityConfig()))
            .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void 차이_경로_수는_제한된다() {
        // given
        ObjectMapper objectMapper = Documents.objectMapper();
        JsonTreeDiff diff = new JsonTreeDiff(Set.of(), 2);

        // when
        List<String> paths = diff.diff(
            objectMapper.createObjectNode().put("a", 1).put("b", 2).put("c", 3),
            objectMapper.createObjectNode());

        // then
        assertThat(paths).containsExactly("/a", "/b");
    }
}
