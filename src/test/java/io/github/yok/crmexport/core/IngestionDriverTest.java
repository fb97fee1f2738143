package io.github.yok.crmexport.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.crmexport.checkpoint.CheckpointKey;
import io.github.yok.crmexport.checkpoint.FileCheckpointStore;
import io.github.yok.crmexport.client.TransportException;
import io.github.yok.crmexport.db.RecordSink;
import io.github.yok.crmexport.fetch.AssociationFetcher;
import io.github.yok.crmexport.fetch.PageFetcher;
import io.github.yok.crmexport.fetch.PageFetcherRegistry;
import io.github.yok.crmexport.model.AssociationEdge;
import io.github.yok.crmexport.model.CrmRecord;
import io.github.yok.crmexport.model.Phase;
import io.github.yok.crmexport.model.PhaseResult;
import io.github.yok.crmexport.model.PhaseState;
import io.github.yok.crmexport.model.RecordPage;
import io.github.yok.crmexport.model.ResourceType;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IngestionDriverTest {

    private static final CheckpointKey CONTACTS_DATA =
            CheckpointKey.of(ResourceType.CONTACTS, Phase.DATA);
    private static final CheckpointKey NOTES_ASSOC =
            CheckpointKey.of(ResourceType.NOTES, Phase.ASSOCIATIONS);

    @TempDir
    Path tempDir;

    private FileCheckpointStore checkpoints;
    private InMemorySink sink;
    private ScriptedFetcher fetcher;
    private AssociationFetcher associationFetcher;
    private IngestionDriver driver;

    @BeforeEach
    void setup() {
        checkpoints = new FileCheckpointStore(tempDir.resolve("state"));
        sink = new InMemorySink();
        fetcher = new ScriptedFetcher();
        associationFetcher = mock(AssociationFetcher.class);
        driver = new IngestionDriver(
                new PageFetcherRegistry(Map.of(ResourceType.CONTACTS, fetcher,
                        ResourceType.NOTES, fetcher)),
                associationFetcher, checkpoints, sink);
    }

    /** Page of {@code size} records with consecutive ids starting at {@code firstId}. */
    private static RecordPage page(int firstId, int size) {
        List<CrmRecord> records = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            records.add(new CrmRecord(String.valueOf(firstId + i), Map.of("email", "x")));
        }
        return new RecordPage(records);
    }

    // ----- ingestData -----

    @Test
    void ingestData_正常ケース_100件と30件の後に空ページ_130件保存され完了マーカーが作成されること() throws Exception {
        fetcher.then(page(1, 100)).then(page(101, 30)).then(RecordPage.empty());

        PhaseResult result = driver.ingestData(ResourceType.CONTACTS, null);

        assertEquals(PhaseState.COMPLETE, result.getState());
        assertEquals(130, result.getProcessed());
        assertEquals(130, sink.count(ResourceType.CONTACTS));
        assertEquals(Optional.empty(), checkpoints.load(CONTACTS_DATA));
        assertTrue(checkpoints.isPhaseComplete(CONTACTS_DATA));
        assertEquals(Arrays.asList(null, "100", "130"), fetcher.cursors);
    }

    @Test
    void ingestData_正常ケース_チェックポイントあり_保存されたカーソルから再開すること() throws Exception {
        checkpoints.save(CONTACTS_DATA, "200");
        fetcher.then(page(201, 10)).then(RecordPage.empty());

        PhaseResult result = driver.ingestData(ResourceType.CONTACTS, null);

        assertEquals(List.of("200", "210"), fetcher.cursors);
        assertEquals(PhaseState.COMPLETE, result.getState());
        assertEquals(10, result.getProcessed());
    }

    @Test
    void ingestData_正常ケース_途中で中断_次回は最後に保存したカーソルから再開し欠落しないこと()
            throws Exception {
        fetcher.then(page(1, 100)).then(page(101, 100))
                .thenThrow(() -> new TransportException("GET failed", null));

        assertThrows(TransportException.class,
                () -> driver.ingestData(ResourceType.CONTACTS, null));
        assertEquals(Optional.of("200"), checkpoints.load(CONTACTS_DATA));
        assertFalse(checkpoints.isPhaseComplete(CONTACTS_DATA));

        ScriptedFetcher resumed = new ScriptedFetcher().then(page(201, 50))
                .then(RecordPage.empty());
        IngestionDriver second = new IngestionDriver(
                new PageFetcherRegistry(Map.of(ResourceType.CONTACTS, resumed)),
                associationFetcher, checkpoints, sink);
        PhaseResult result = second.ingestData(ResourceType.CONTACTS, null);

        assertEquals(List.of("200", "250"), resumed.cursors);
        assertEquals(PhaseState.COMPLETE, result.getState());
        assertEquals(250, sink.count(ResourceType.CONTACTS));
    }

    @Test
    void ingestData_異常ケース_最初のページで転送失敗_チェックポイントが作成されないこと() {
        fetcher.thenThrow(() -> new TransportException("GET failed after 5 attempts", null));

        assertThrows(TransportException.class,
                () -> driver.ingestData(ResourceType.CONTACTS, null));

        assertEquals(Optional.empty(), checkpoints.load(CONTACTS_DATA));
        assertFalse(checkpoints.isPhaseComplete(CONTACTS_DATA));
        assertEquals(0, sink.count(ResourceType.CONTACTS));
    }

    @Test
    void ingestData_正常ケース_カーソルが3回連続で進まない_3回で停止しマーカーなしであること()
            throws Exception {
        checkpoints.save(CONTACTS_DATA, "500");
        for (int i = 0; i < 10; i++) {
            fetcher.then(page(500, 1));
        }

        PhaseResult result = driver.ingestData(ResourceType.CONTACTS, null);

        assertEquals(PhaseState.STUCK, result.getState());
        assertEquals(3, fetcher.cursors.size());
        assertEquals(Optional.of("500"), checkpoints.load(CONTACTS_DATA));
        assertFalse(checkpoints.isPhaseComplete(CONTACTS_DATA));
    }

    @Test
    void ingestData_正常ケース_カーソルが一度進めば停止カウンタがリセットされること() throws Exception {
        checkpoints.save(CONTACTS_DATA, "7");
        fetcher.then(page(7, 1)).then(page(7, 1)).then(page(8, 1)).then(page(8, 1))
                .then(page(8, 1)).then(RecordPage.empty());

        PhaseResult result = driver.ingestData(ResourceType.CONTACTS, null);

        assertEquals(PhaseState.COMPLETE, result.getState());
        assertEquals(6, fetcher.cursors.size());
    }

    @Test
    void ingestData_正常ケース_上限50件でページ20件_3ページで停止しチェックポイントが削除されること()
            throws Exception {
        for (int i = 0; i < 10; i++) {
            fetcher.then(page(i * 20 + 1, 20));
        }

        PhaseResult result = driver.ingestData(ResourceType.CONTACTS, 50);

        assertEquals(PhaseState.LIMITED, result.getState());
        assertEquals(3, fetcher.cursors.size());
        assertEquals(60, result.getProcessed());
        assertEquals(Optional.empty(), checkpoints.load(CONTACTS_DATA));
        assertFalse(checkpoints.isPhaseComplete(CONTACTS_DATA));
    }

    @Test
    void ingestData_正常ケース_上限内で空ページに到達_チェックポイントが削除されマーカーなしであること()
            throws Exception {
        fetcher.then(page(1, 1)).then(RecordPage.empty());

        PhaseResult result = driver.ingestData(ResourceType.CONTACTS, 50);

        assertEquals(PhaseState.DRAINED, result.getState());
        assertEquals(1, result.getProcessed());
        assertEquals(Optional.empty(), checkpoints.load(CONTACTS_DATA));
        assertFalse(checkpoints.isPhaseComplete(CONTACTS_DATA));
    }

    @Test
    void ingestData_正常ケース_上限0は無制限として扱われること() throws Exception {
        fetcher.then(page(1, 20)).then(RecordPage.empty());

        assertEquals(PhaseState.COMPLETE, driver.ingestData(ResourceType.CONTACTS, 0).getState());
    }

    @Test
    void ingestData_正常ケース_完了マーカーあり_取得せずスキップされること() throws Exception {
        checkpoints.markComplete(CONTACTS_DATA);

        PhaseResult result = driver.ingestData(ResourceType.CONTACTS, null);

        assertEquals(PhaseState.SKIPPED, result.getState());
        assertTrue(fetcher.cursors.isEmpty());
    }

    @Test
    void ingestData_正常ケース_空ページで完了後_次回の実行はスキップされること() throws Exception {
        fetcher.then(RecordPage.empty());
        assertEquals(PhaseState.COMPLETE, driver.ingestData(ResourceType.CONTACTS, null).getState());

        assertEquals(PhaseState.SKIPPED, driver.ingestData(ResourceType.CONTACTS, null).getState());
        assertEquals(1, fetcher.cursors.size());
    }

    // ----- ingestAssociations -----

    private void storeNotes(String... ids) throws Exception {
        List<CrmRecord> records = new ArrayList<>();
        for (String id : ids) {
            records.add(new CrmRecord(id, Map.of()));
        }
        sink.upsertRecords(ResourceType.NOTES, records);
    }

    private static List<AssociationEdge> edgeTo(String fromId, String toId) {
        return List.of(
                new AssociationEdge(ResourceType.NOTES, fromId, ResourceType.CONTACTS, toId));
    }

    @Test
    void ingestAssociations_正常ケース_全IDを処理し完了マーカーが作成されること() throws Exception {
        storeNotes("3", "1", "2");
        when(associationFetcher.fetchEdges(any(), anyString()))
                .thenAnswer(inv -> edgeTo(inv.getArgument(1), "c" + inv.getArgument(1)));

        PhaseResult result = driver.ingestAssociations(ResourceType.NOTES, null);

        assertEquals(PhaseState.COMPLETE, result.getState());
        assertEquals(3, result.getProcessed());
        assertEquals(List.of("1", "2", "3"), sink.edgeSources());
        assertTrue(checkpoints.isPhaseComplete(NOTES_ASSOC));
        assertEquals(Optional.empty(), checkpoints.load(NOTES_ASSOC));
    }

    @Test
    void ingestAssociations_正常ケース_保存されたインデックスから再開すること() throws Exception {
        storeNotes("a", "b", "c", "d");
        checkpoints.save(NOTES_ASSOC, "2");
        when(associationFetcher.fetchEdges(any(), anyString()))
                .thenAnswer(inv -> edgeTo(inv.getArgument(1), "x"));

        PhaseResult result = driver.ingestAssociations(ResourceType.NOTES, null);

        assertEquals(List.of("c", "d"), sink.edgeSources());
        assertEquals(2, result.getProcessed());
        verify(associationFetcher, never()).fetchEdges(ResourceType.NOTES, "a");
    }

    @Test
    void ingestAssociations_正常ケース_インデックスが件数を超える_先頭から再処理すること() throws Exception {
        storeNotes("a", "b");
        checkpoints.save(NOTES_ASSOC, "10");
        when(associationFetcher.fetchEdges(any(), anyString()))
                .thenAnswer(inv -> edgeTo(inv.getArgument(1), "x"));

        driver.ingestAssociations(ResourceType.NOTES, null);

        assertEquals(List.of("a", "b"), sink.edgeSources());
    }

    @Test
    void ingestAssociations_正常ケース_上限到達_チェックポイントが削除されマーカーなしであること()
            throws Exception {
        storeNotes("a", "b", "c", "d");
        when(associationFetcher.fetchEdges(any(), anyString()))
                .thenAnswer(inv -> edgeTo(inv.getArgument(1), "x"));

        PhaseResult result = driver.ingestAssociations(ResourceType.NOTES, 2);

        assertEquals(PhaseState.LIMITED, result.getState());
        assertEquals(List.of("a", "b"), sink.edgeSources());
        assertEquals(Optional.empty(), checkpoints.load(NOTES_ASSOC));
        assertFalse(checkpoints.isPhaseComplete(NOTES_ASSOC));
    }

    @Test
    void ingestAssociations_正常ケース_上限内で全IDを処理_マーカーなしであること() throws Exception {
        storeNotes("a");
        when(associationFetcher.fetchEdges(any(), anyString()))
                .thenAnswer(inv -> edgeTo(inv.getArgument(1), "x"));

        PhaseResult result = driver.ingestAssociations(ResourceType.NOTES, 50);

        assertEquals(PhaseState.DRAINED, result.getState());
        assertEquals(List.of("a"), sink.edgeSources());
        assertEquals(Optional.empty(), checkpoints.load(NOTES_ASSOC));
        assertFalse(checkpoints.isPhaseComplete(NOTES_ASSOC));
    }

    @Test
    void ingestAssociations_正常ケース_IDが不完全_全IDを処理するがマーカーなしであること()
            throws Exception {
        storeNotes("a", "b");
        when(associationFetcher.fetchEdges(any(), anyString()))
                .thenAnswer(inv -> edgeTo(inv.getArgument(1), "x"));

        PhaseResult result = driver.ingestAssociations(ResourceType.NOTES, null, false);

        assertEquals(PhaseState.DRAINED, result.getState());
        assertEquals(List.of("a", "b"), sink.edgeSources());
        assertFalse(checkpoints.isPhaseComplete(NOTES_ASSOC));
    }

    @Test
    void ingestAssociations_異常ケース_途中で転送失敗_処理済みの次のインデックスが保存されていること()
            throws Exception {
        storeNotes("a", "b", "c");
        when(associationFetcher.fetchEdges(ResourceType.NOTES, "a")).thenReturn(edgeTo("a", "x"));
        when(associationFetcher.fetchEdges(ResourceType.NOTES, "b"))
                .thenThrow(new TransportException("boom", null));

        assertThrows(TransportException.class,
                () -> driver.ingestAssociations(ResourceType.NOTES, null));

        assertEquals(Optional.of("1"), checkpoints.load(NOTES_ASSOC));
    }

    @Test
    void ingestAssociations_正常ケース_関連先のない種別_スキップされること() throws Exception {
        PhaseResult result = driver.ingestAssociations(ResourceType.CONTACTS, null);

        assertEquals(PhaseState.SKIPPED, result.getState());
        assertNull(result.getLastPosition());
        assertFalse(checkpoints.isPhaseComplete(
                CheckpointKey.of(ResourceType.CONTACTS, Phase.ASSOCIATIONS)));
    }

    @Test
    void ingestAssociations_正常ケース_完了マーカーあり_スキップされること() throws Exception {
        storeNotes("a");
        checkpoints.markComplete(NOTES_ASSOC);

        assertEquals(PhaseState.SKIPPED,
                driver.ingestAssociations(ResourceType.NOTES, null).getState());
        verify(associationFetcher, never()).fetchEdges(any(), anyString());
    }

    // ----- test doubles -----

    /** Returns scripted pages in order and records the cursor of every call. */
    static class ScriptedFetcher implements PageFetcher {

        final List<String> cursors = new ArrayList<>();
        private final Deque<Supplier<RecordPage>> script = new ArrayDeque<>();

        ScriptedFetcher then(RecordPage page) {
            script.add(() -> page);
            return this;
        }

        ScriptedFetcher thenThrow(Supplier<RuntimeException> failure) {
            script.add(() -> {
                throw failure.get();
            });
            return this;
        }

        @Override
        public RecordPage fetchPage(String cursor) {
            cursors.add(cursor);
            if (script.isEmpty()) {
                throw new AssertionError("Unexpected fetch after " + cursor);
            }
            return script.poll().get();
        }
    }

    /** Keeps records per type keyed by id, like an upsert table. */
    static class InMemorySink implements RecordSink {

        private final Map<ResourceType, TreeMap<String, CrmRecord>> tables =
                new EnumMap<>(ResourceType.class);
        private final List<AssociationEdge> edges = new ArrayList<>();

        @Override
        public void upsertRecords(ResourceType type, List<CrmRecord> batch) {
            TreeMap<String, CrmRecord> table = tables.computeIfAbsent(type, t -> new TreeMap<>());
            batch.forEach(r -> table.put(r.getId(), r));
        }

        @Override
        public void insertAssociations(List<AssociationEdge> newEdges) {
            edges.addAll(newEdges);
        }

        @Override
        public List<String> listIds(ResourceType type) {
            return new ArrayList<>(tables.getOrDefault(type, new TreeMap<>()).keySet());
        }

        @Override
        public long countRecords(ResourceType type) {
            return tables.getOrDefault(type, new TreeMap<>()).size();
        }

        long count(ResourceType type) {
            return countRecords(type);
        }

        List<String> edgeSources() {
            List<String> sources = new ArrayList<>();
            edges.forEach(e -> sources.add(e.getFromId()));
            return sources;
        }
    }
}
