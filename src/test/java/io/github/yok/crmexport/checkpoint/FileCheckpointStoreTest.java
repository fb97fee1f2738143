package io.github.yok.crmexport.checkpoint;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import io.github.yok.crmexport.config.PathsConfig;
import io.github.yok.crmexport.model.Phase;
import io.github.yok.crmexport.model.ResourceType;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileCheckpointStoreTest {

    private static final CheckpointKey CONTACTS =
            CheckpointKey.of(ResourceType.CONTACTS, Phase.DATA);
    private static final CheckpointKey CONTACTS_ASSOC =
            CheckpointKey.of(ResourceType.CONTACTS, Phase.ASSOCIATIONS);

    @TempDir
    Path tempDir;

    private Path stateDir;
    private FileCheckpointStore store;

    @BeforeEach
    void setup() {
        stateDir = tempDir.resolve("state");
        store = new FileCheckpointStore(stateDir);
    }

    // ----- constructor -----

    @Test
    void コンストラクタ_正常ケース_PathsConfigのstate配下に保存されること() throws Exception {
        PathsConfig pathsConfig = mock(PathsConfig.class);
        when(pathsConfig.getState()).thenReturn(stateDir.toString());

        new FileCheckpointStore(pathsConfig).save(CONTACTS, "5");

        assertTrue(Files.exists(stateDir.resolve("contacts_checkpoint.txt")));
    }

    // ----- save / load -----

    @Test
    void load_正常ケース_ファイルがない_空が返ること() {
        assertEquals(Optional.empty(), store.load(CONTACTS));
    }

    @Test
    void save_正常ケース_保存した値が読み戻せ一時ファイルが残らないこと() throws Exception {
        store.save(CONTACTS, "100");
        store.save(CONTACTS, "200");

        assertEquals(Optional.of("200"), store.load(CONTACTS));
        try (Stream<Path> files = Files.list(stateDir)) {
            assertEquals(List.of("contacts_checkpoint.txt"),
                    files.map(p -> p.getFileName().toString()).sorted()
                            .collect(Collectors.toList()));
        }
    }

    @Test
    void save_正常ケース_関連フェーズは別ファイルに保存されること() {
        store.save(CONTACTS, "abc");
        store.save(CONTACTS_ASSOC, "3");

        assertTrue(Files.exists(stateDir.resolve("contacts_associations_checkpoint.txt")));
        assertEquals(Optional.of("abc"), store.load(CONTACTS));
        assertEquals(Optional.of("3"), store.load(CONTACTS_ASSOC));
    }

    @Test
    void save_異常ケース_stateがファイルで作成できない_CheckpointExceptionが送出されること()
            throws Exception {
        Files.writeString(stateDir, "not a directory");

        assertThrows(CheckpointException.class, () -> store.save(CONTACTS, "1"));
    }

    @Test
    void load_異常ケース_破損したファイル_空が返ること() throws Exception {
        Files.createDirectories(stateDir);
        Files.writeString(stateDir.resolve("contacts_checkpoint.txt"), "garbage",
                StandardCharsets.UTF_8);

        assertEquals(Optional.empty(), store.load(CONTACTS));
    }

    @Test
    void load_異常ケース_チェックサム不一致_空が返ること() throws Exception {
        store.save(CONTACTS, "100");
        Path file = stateDir.resolve("contacts_checkpoint.txt");
        Files.writeString(file, Files.readString(file).replace("value=100", "value=101"));

        assertEquals(Optional.empty(), store.load(CONTACTS));
    }

    // ----- clear -----

    @Test
    void clear_正常ケース_チェックポイントが削除されること() {
        store.save(CONTACTS, "100");
        store.clear(CONTACTS);
        store.clear(CONTACTS);

        assertEquals(Optional.empty(), store.load(CONTACTS));
    }

    // ----- markComplete / isPhaseComplete -----

    @Test
    void markComplete_正常ケース_完了マーカーに日時が書き込まれること() throws Exception {
        assertFalse(store.isPhaseComplete(CONTACTS));

        store.markComplete(CONTACTS);

        assertTrue(store.isPhaseComplete(CONTACTS));
        assertFalse(store.isPhaseComplete(CONTACTS_ASSOC));
        String marker = Files.readString(stateDir.resolve("contacts_completed.txt")).trim();
        assertTrue(marker.matches("Completed on \\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}"),
                marker);
    }

    // ----- reset -----

    @Test
    void reset_正常ケース_指定種別の全ファイルのみ削除されること() {
        CheckpointKey companies = CheckpointKey.of(ResourceType.COMPANIES, Phase.DATA);
        store.save(CONTACTS, "1");
        store.markComplete(CONTACTS_ASSOC);
        store.markComplete(companies);

        store.reset(List.of(ResourceType.CONTACTS));

        assertEquals(Optional.empty(), store.load(CONTACTS));
        assertFalse(store.isPhaseComplete(CONTACTS_ASSOC));
        assertTrue(store.isPhaseComplete(companies));
    }
}
