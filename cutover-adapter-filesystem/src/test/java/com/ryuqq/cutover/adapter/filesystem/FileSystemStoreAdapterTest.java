package com.ryuqq.cutover.adapter.filesystem;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.cutover.core.model.CorrelationId;
import com.ryuqq.cutover.core.model.ExpectedVersion;
import com.ryuqq.cutover.core.model.KeyPrefix;
import com.ryuqq.cutover.core.model.Payload;
import com.ryuqq.cutover.core.model.RecordKey;
import com.ryuqq.cutover.core.model.StoredRecord;
import com.ryuqq.cutover.core.model.Table;
import com.ryuqq.cutover.core.model.VersionToken;
import com.ryuqq.cutover.core.spi.StoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FileSystemStoreAdapter 파일 레이아웃 테스트.
 *
 * @author Cutover Team
 * @since 1.0.0
 */
class FileSystemStoreAdapterTest {

    private static final CorrelationId CID = CorrelationId.of("fs-test");

    @TempDir
    Path root;

    private FileSystemStoreAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new FileSystemStoreAdapter("legacy", root);
    }

    @Test
    void put_envelope_파일을_테이블_파티션_로우_경로에_쓴다() throws Exception {
        // given
        RecordKey key = RecordKey.dateIndex(LocalDate.of(2025, 8, 8), "acme", "h1");

        // when
        VersionToken token = adapter.put(key, Payload.of("{\"huntId\":\"h1\"}"), ExpectedVersion.absent(), CID);

        // then
        Path file = root.resolve("date-index").resolve("2025-08-08").resolve("acme%3Ah1.json");
        assertThat(file).exists();
        JsonNode envelope = new ObjectMapper().readTree(file.toFile());
        assertThat(envelope.get("version").asText()).isEqualTo(token.getValue());
        assertThat(envelope.get("payload").asText()).isEqualTo("{\"huntId\":\"h1\"}");
        assertThat(envelope.hasNonNull("updatedAt")).isTrue();
    }

    @Test
    void put_임시파일을_남기지_않는다() throws Exception {
        // given
        RecordKey key = RecordKey.organization("acme");

        // when
        adapter.put(key, Payload.of("{}"), ExpectedVersion.any(), CID);
        adapter.put(key, Payload.of("{\"v\":2}"), ExpectedVersion.any(), CID);

        // then
        try (Stream<Path> files = Files.list(root.resolve("organizations").resolve("acme"))) {
            assertThat(files.map(p -> p.getFileName().toString()).collect(Collectors.toList()))
                .containsExactly("org.json");
        }
    }

    @Test
    void 재시작후에도_레코드와_토큰이_유지된다() {
        // given
        RecordKey key = RecordKey.registry();
        VersionToken token = adapter.put(key, Payload.of("{\"app\":{}}"), ExpectedVersion.absent(), CID);

        // when
        FileSystemStoreAdapter reopened = new FileSystemStoreAdapter("legacy", root);
        StoredRecord record = reopened.get(key, CID).orElseThrow();

        // then
        assertThat(record.version()).isEqualTo(token);
        assertThat(record.payload().getValue()).isEqualTo("{\"app\":{}}");
    }

    @Test
    void 선두_점이_있는_키도_숨김파일이_되지_않는다() {
        // given
        RecordKey key = new RecordKey(Table.ORGANIZATIONS, ".hidden", "org");

        // when
        adapter.put(key, Payload.of("{}"), ExpectedVersion.any(), CID);

        // then
        List<RecordKey> keys;
        try (Stream<StoredRecord> stream = adapter.query(KeyPrefix.allOf(Table.ORGANIZATIONS), CID)) {
            keys = stream.map(StoredRecord::key).collect(Collectors.toList());
        }
        assertThat(keys).containsExactly(key);
    }

    @Test
    void 손상된_envelope은_StoreUnavailableException() throws Exception {
        // given
        Path dir = root.resolve("organizations").resolve("broken");
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("org.json"), "{not json");

        // when & then
        assertThatThrownBy(() -> adapter.get(RecordKey.organization("broken"), CID))
            .isInstanceOf(StoreUnavailableException.class)
            .hasMessageContaining("Corrupt envelope");
    }

    @Test
    void query_테이블_디렉터리가_없으면_빈_스트림() {
        try (Stream<StoredRecord> stream = adapter.query(KeyPrefix.allOf(Table.REGISTRY), CID)) {
            assertThat(stream).isEmpty();
        }
    }

    @Test
    void keyCodec_인코딩은_디코딩으로_복원된다() {
        assertThat(KeyCodec.decode(KeyCodec.encode("acme:h1"))).isEqualTo("acme:h1");
        assertThat(KeyCodec.encode(".x")).startsWith("%2E");
        assertThat(KeyCodec.decode(KeyCodec.encode(".x"))).isEqualTo(".x");
    }
}
