package me.golemcore.courier.adapter.outbound.storage;

import me.golemcore.courier.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TEST_DIR = "schedules";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void putTextAtomicAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "U1.json", "[]").get();

        assertEquals("[]", storageAdapter.getText(TEST_DIR, "U1.json").get());
        assertFalse(Files.exists(tempDir.resolve(TEST_DIR).resolve("U1.json.tmp")));
    }

    @Test
    void putTextAtomic_replacesExistingContent() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "U1.json", "old").get();
        storageAdapter.putTextAtomic(TEST_DIR, "U1.json", "new").get();

        assertEquals("new", storageAdapter.getText(TEST_DIR, "U1.json").get());
    }

    @Test
    void putTextAtomic_createsParentDirectories() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "nested/U1.json", "[]").get();

        assertTrue(Files.isRegularFile(tempDir.resolve(TEST_DIR).resolve("nested").resolve("U1.json")));
    }

    @Test
    void getText_returnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(TEST_DIR, "missing.json").get());
    }

    @Test
    void putTextAtomic_blocksPathTraversal() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.putTextAtomic(TEST_DIR, "../../escape.json", "[]").get());
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }

    @Test
    void listObjects_returnsSortedNames() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TEST_DIR, "b.json", "[]").get();
        storageAdapter.putTextAtomic(TEST_DIR, "a.json", "[]").get();
        storageAdapter.putTextAtomic(TEST_DIR, "c.txt", "x").get();

        assertEquals(List.of("a.json", "b.json", "c.txt"), storageAdapter.listObjects(TEST_DIR, null).get());
        assertEquals(List.of("a.json"), storageAdapter.listObjects(TEST_DIR, "a").get());
    }

    @Test
    void listObjects_returnsEmptyForMissingDirectory() throws ExecutionException, InterruptedException {
        assertTrue(storageAdapter.listObjects("nope", null).get().isEmpty());
    }

    @Test
    void ensureDirectory_createsDirectory() throws ExecutionException, InterruptedException {
        storageAdapter.ensureDirectory(TEST_DIR).get();

        assertTrue(Files.isDirectory(tempDir.resolve(TEST_DIR)));
    }

    @Test
    void pathTraversalIsBlocked() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText(TEST_DIR, "../../etc/passwd").get());
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }
}
