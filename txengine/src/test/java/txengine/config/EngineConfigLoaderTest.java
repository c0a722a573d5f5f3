package txengine.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import txengine.state.CompressionType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearOverrides() {
        System.clearProperty("txengine.history.size");
    }

    @Test
    void loadFromPropertiesFile() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, """
                txengine.history.size=25
                txengine.alert.level=ERROR
                txengine.operation.timeout.enforced=true
                txengine.rollback.parallelism=8
                txengine.rollback.max.age=3600
                txengine.snapshot.compression=GZIP
                txengine.snapshot.checksum.algorithm=SHA-512
                """);

        EngineConfig c = EngineConfigLoader.loadFromFile(f);

        assertEquals(25, c.historySize());
        assertEquals(AlertLevel.ERROR, c.alertLevel());
        assertTrue(c.operationTimeoutEnforced());
        assertEquals(8, c.rollbackParallelism());
        assertEquals(Duration.ofHours(1), c.rollbackMaxAge());
        assertEquals(CompressionType.GZIP, c.snapshotCompression());
        assertEquals("SHA-512", c.checksumAlgorithm());
    }

    @Test
    void loadFromYamlFile() throws IOException {
        Path f = tempDir.resolve("test.yml");
        Files.writeString(f, """
                txengine:
                  history:
                    size: 30
                  alert:
                    level: DEBUG
                  operation:
                    timeout:
                      enforced: true
                  snapshot:
                    compression: gzip
                """);

        EngineConfig c = EngineConfigLoader.loadFromFile(f);

        assertEquals(30, c.historySize());
        assertEquals(AlertLevel.DEBUG, c.alertLevel());
        assertTrue(c.operationTimeoutEnforced());
        assertEquals(CompressionType.GZIP, c.snapshotCompression());
    }

    @Test
    void emptyYamlUsesDefaults() throws IOException {
        Path f = tempDir.resolve("empty.yaml");
        Files.writeString(f, "");

        EngineConfig c = EngineConfigLoader.loadFromFile(f);

        assertEquals(EngineConfig.DEFAULTS.historySize(), c.historySize());
        assertEquals(AlertLevel.WARNING, c.alertLevel());
    }

    @Test
    void invalidValuesUseDefaults() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, """
                txengine.history.size=-3
                txengine.alert.level=LOUD
                txengine.rollback.parallelism=many
                txengine.snapshot.compression=ZSTD
                txengine.snapshot.checksum.algorithm=NOT-A-DIGEST
                """);

        EngineConfig c = EngineConfigLoader.loadFromFile(f);

        assertEquals(1000, c.historySize());
        assertEquals(AlertLevel.WARNING, c.alertLevel());
        assertEquals(4, c.rollbackParallelism());
        assertEquals(CompressionType.NONE, c.snapshotCompression());
        assertEquals("SHA-256", c.checksumAlgorithm());
        assertFalse(c.operationTimeoutEnforced());
        assertEquals(Duration.ZERO, c.rollbackMaxAge());
    }

    @Test
    void systemPropertiesOverrideFile() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, "txengine.history.size=25\n");
        System.setProperty("txengine.history.size", "77");

        EngineConfig c = EngineConfigLoader.loadFromFile(f);

        assertEquals(77, c.historySize());
    }

    @Test
    void loadsClasspathYaml() {
        EngineConfig c = EngineConfigLoader.load();

        assertEquals(250, c.historySize());
        assertEquals(AlertLevel.DEBUG, c.alertLevel());
        assertEquals(2, c.rollbackParallelism());
    }

    @Test
    void nonexistentFileThrows() {
        Path f = tempDir.resolve("nonexistent.properties");
        assertThrows(IOException.class, () -> EngineConfigLoader.loadFromFile(f));
    }

    @Test
    void builderRejectsNonPositiveSizes() {
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().historySize(0));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().rollbackParallelism(-1));
    }
}
