package me.golemcore.responder.adapter.outbound.storage;

import me.golemcore.responder.infrastructure.config.ResponderProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String STATS_DIR = "stats";
    private static final String PATTERNS_DIR = "patterns";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        ResponderProperties properties = new ResponderProperties();
        properties.getStorage().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void initCreatesKnownDirectories() {
        assertTrue(Files.isDirectory(tempDir.resolve(PATTERNS_DIR)));
        assertTrue(Files.isDirectory(tempDir.resolve(STATS_DIR)));
    }

    // ==================== Append (JSONL) ====================

    @Test
    void appendTextAccumulatesLines() throws ExecutionException, InterruptedException {
        storageAdapter.appendText(STATS_DIR, "2026-01-01.jsonl", "{\"id\":\"1\"}\n").get();
        storageAdapter.appendText(STATS_DIR, "2026-01-01.jsonl", "{\"id\":\"2\"}\n").get();

        assertEquals("{\"id\":\"1\"}\n{\"id\":\"2\"}\n", storageAdapter.getText(STATS_DIR, "2026-01-01.jsonl").get());
    }

    @Test
    void appendTextCreatesParentDirectories() throws ExecutionException, InterruptedException {
        storageAdapter.appendText(STATS_DIR, "feedback/2026-01-01.jsonl", "line\n").get();

        assertTrue(storageAdapter.exists(STATS_DIR, "feedback/2026-01-01.jsonl").get());
    }

    @Test
    void getTextReturnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(STATS_DIR, "missing.jsonl").get());
        assertFalse(storageAdapter.exists(STATS_DIR, "missing.jsonl").get());
    }

    // ==================== Listing ====================

    @Test
    void listObjectsReturnsRelativePathsIncludingSubdirectories() throws ExecutionException, InterruptedException {
        storageAdapter.appendText(STATS_DIR, "2026-01-02.jsonl", "b\n").get();
        storageAdapter.appendText(STATS_DIR, "2026-01-01.jsonl", "a\n").get();
        storageAdapter.appendText(STATS_DIR, "feedback/2026-01-01.jsonl", "f\n").get();

        List<String> files = storageAdapter.listObjects(STATS_DIR, "").get();

        assertEquals(List.of("2026-01-01.jsonl", "2026-01-02.jsonl", "feedback/2026-01-01.jsonl"), files);
    }

    @Test
    void listObjectsFiltersByPrefix() throws ExecutionException, InterruptedException {
        storageAdapter.appendText(STATS_DIR, "2026-01-01.jsonl", "a\n").get();
        storageAdapter.appendText(STATS_DIR, "feedback/2026-01-01.jsonl", "f\n").get();

        assertEquals(List.of("feedback/2026-01-01.jsonl"), storageAdapter.listObjects(STATS_DIR, "feedback/").get());
        assertEquals(2, storageAdapter.listObjects(STATS_DIR, null).get().size());
    }

    @Test
    void listObjectsOnMissingDirectoryIsEmpty() throws ExecutionException, InterruptedException {
        assertTrue(storageAdapter.listObjects("nothing-here", "").get().isEmpty());
    }

    @Test
    void ensureDirectoryCreatesDirectory() throws ExecutionException, InterruptedException {
        storageAdapter.ensureDirectory("exports").get();

        assertTrue(Files.isDirectory(tempDir.resolve("exports")));
    }

    // ==================== Path traversal ====================

    @Test
    void blocksPathTraversal() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.appendText(STATS_DIR, "../../etc/passwd", "x").get());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }

    @Test
    void blocksPathTraversalOnRead() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText(PATTERNS_DIR, "../../../secret").get());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }

    // ==================== Atomic write ====================

    @Test
    void putTextAtomicKeepsBackupOfPreviousVersion() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(PATTERNS_DIR, "patterns.json", "{\"version\":1}", true).get();
        storageAdapter.putTextAtomic(PATTERNS_DIR, "patterns.json", "{\"version\":2}", true).get();

        assertEquals("{\"version\":2}", storageAdapter.getText(PATTERNS_DIR, "patterns.json").get());
        assertEquals("{\"version\":1}", storageAdapter.getText(PATTERNS_DIR, "patterns.json.bak").get());
        assertFalse(storageAdapter.exists(PATTERNS_DIR, "patterns.json.tmp").get());
    }

    @Test
    void putTextAtomicWithoutBackupLeavesNoBackup() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(PATTERNS_DIR, "patterns.json", "first", false).get();
        storageAdapter.putTextAtomic(PATTERNS_DIR, "patterns.json", "second", false).get();

        assertEquals("second", storageAdapter.getText(PATTERNS_DIR, "patterns.json").get());
        assertFalse(storageAdapter.exists(PATTERNS_DIR, "patterns.json.bak").get());
    }

    @Test
    void putTextAtomicPreservesUnicode() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(PATTERNS_DIR, "emoji.json", "👋 ✨ 🚨", false).get();

        assertEquals("👋 ✨ 🚨", storageAdapter.getText(PATTERNS_DIR, "emoji.json").get());
    }
}
