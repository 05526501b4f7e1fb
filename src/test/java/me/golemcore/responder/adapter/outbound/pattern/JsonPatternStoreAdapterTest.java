package me.golemcore.responder.adapter.outbound.pattern;

import me.golemcore.responder.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.responder.domain.model.MessageType;
import me.golemcore.responder.domain.model.ResponsePattern;
import me.golemcore.responder.domain.model.ResponsePriority;
import me.golemcore.responder.domain.service.BuiltinPatterns;
import me.golemcore.responder.domain.service.PatternRegistry;
import me.golemcore.responder.domain.service.PatternValidator;
import me.golemcore.responder.infrastructure.config.AutoConfiguration;
import me.golemcore.responder.infrastructure.config.ResponderProperties;
import me.golemcore.responder.port.outbound.StoragePort;
import me.golemcore.responder.testsupport.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JsonPatternStoreAdapterTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private ResponderProperties properties;
    private ObjectMapper objectMapper;
    private MutableClock clock;
    private JsonPatternStoreAdapter store;

    @BeforeEach
    void setUp() {
        properties = new ResponderProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        clock = new MutableClock(NOW);
        store = new JsonPatternStoreAdapter(storage, objectMapper, clock);
    }

    private static ResponsePattern pattern(String id) {
        return ResponsePattern.builder()
                .id(id)
                .trigger("^" + id)
                .messageType(MessageType.COMMAND)
                .priority(ResponsePriority.HIGH)
                .template("reply {{firstName|there}}")
                .description("test " + id)
                .keywords(new LinkedHashSet<>(List.of("k1", "k2")))
                .baseConfidence(0.9)
                .minConfidence(0.8)
                .requiresContext(true)
                .requiredContext(new LinkedHashSet<>(Set.of("firstName")))
                .updatedAt(NOW)
                .build();
    }

    @Test
    void emptyStoreLoadsNothing() {
        assertTrue(store.loadAll().isEmpty());
    }

    @Test
    void savedPatternSurvivesReload() {
        ResponsePattern original = pattern("a");
        store.save(original);

        JsonPatternStoreAdapter reopened = new JsonPatternStoreAdapter(storageAt(tempDir), objectMapper, clock);
        List<ResponsePattern> loaded = reopened.loadAll();

        assertEquals(List.of(original), loaded);
    }

    @Test
    void saveReplacesPatternWithSameId() {
        store.save(pattern("a"));
        ResponsePattern changed = pattern("a");
        changed.setTemplate("changed");

        store.save(changed);

        assertEquals(1, store.loadAll().size());
        assertEquals("changed", store.loadAll().get(0).getTemplate());
    }

    @Test
    void saveAllReplacesEverything() {
        store.save(pattern("a"));

        store.saveAll(List.of(pattern("b"), pattern("c")));

        assertEquals(List.of("b", "c"), store.loadAll().stream().map(ResponsePattern::getId).toList());
    }

    @Test
    void deleteRemovesOnlyExistingIds() {
        store.saveAll(List.of(pattern("a"), pattern("b")));

        assertTrue(store.delete("a"));
        assertFalse(store.delete("a"));
        assertEquals(List.of("b"), store.loadAll().stream().map(ResponsePattern::getId).toList());
    }

    @Test
    void writesKeepBackupOfPreviousDocument() {
        store.save(pattern("a"));
        store.save(pattern("b"));

        assertTrue(Files.exists(tempDir.resolve("patterns").resolve("patterns.json.bak")));
    }

    @Test
    void malformedDocumentFailsLoudly() {
        StoragePort broken = mock(StoragePort.class);
        when(broken.getText(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture("{not json"));
        JsonPatternStoreAdapter brokenStore = new JsonPatternStoreAdapter(broken, objectMapper, clock);

        assertThrows(IllegalStateException.class, brokenStore::loadAll);
    }

    @Test
    void registrySeedsBuiltinsIntoEmptyStoreAndReadsThemBack() {
        PatternRegistry registry = new PatternRegistry(store, new PatternValidator(), properties, clock);
        registry.reload();

        PatternRegistry restarted = new PatternRegistry(
                new JsonPatternStoreAdapter(storageAt(tempDir), objectMapper, clock),
                new PatternValidator(), properties, clock);
        restarted.reload();

        assertEquals(BuiltinPatterns.defaults().size(), restarted.currentSnapshot().size());
        assertTrue(restarted.get(BuiltinPatterns.CRYPTO_TOPIC).orElseThrow().isRequiresContext());
    }

    private LocalStorageAdapter storageAt(Path base) {
        ResponderProperties other = new ResponderProperties();
        other.getStorage().setBasePath(base.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(other);
        storage.init();
        return storage;
    }
}
