package com.includeslice.cli;

import com.includeslice.cli.config.CleanerConfig;
import com.includeslice.cli.config.ConfigReader;
import com.includeslice.core.analysis.AnalysisConfig;
import com.includeslice.core.analysis.Policy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigReaderTest {

    private final ConfigReader reader = new ConfigReader();

    @Test
    void roundTrip(@TempDir Path tmp) throws IOException {
        String json = """
            {
              "construction": true,
              "members": false,
              "operators": true,
              "analyze_stdlib": true,
              "show_satisfied": true,
              "fail_on_unused": true
            }
            """;
        Path file = tmp.resolve("include-slice.json");
        Files.writeString(file, json);

        CleanerConfig config = reader.read(file);
        assertTrue(config.isConstruction());
        assertFalse(config.isMembers());
        assertTrue(config.isOperators());
        assertTrue(config.isAnalyzeStdlib());
        assertTrue(config.isShowSatisfied());
        assertTrue(config.isFailOnUnused());
        assertEquals(new AnalysisConfig(new Policy(true, false, true), true, true), config.toAnalysisConfig());
    }

    @Test
    void missingFieldsDefaultToOff(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("include-slice.json");
        Files.writeString(file, "{}");

        CleanerConfig config = reader.read(file);
        assertFalse(config.isFailOnUnused());
        assertEquals(AnalysisConfig.DEFAULT, config.toAnalysisConfig());
    }

    @Test
    void fileNotFoundThrowsConfigReadException() {
        Path missing = Path.of("/tmp/does-not-exist-include-slice.json");
        assertThrows(ConfigReader.ConfigReadException.class, () -> reader.read(missing));
    }

    @Test
    void emptyFileThrowsConfigReadException(@TempDir Path tmp) throws IOException {
        Path empty = tmp.resolve("empty.json");
        Files.writeString(empty, "");
        assertThrows(ConfigReader.ConfigReadException.class, () -> reader.read(empty));
    }

    @Test
    void malformedFileThrowsConfigReadException(@TempDir Path tmp) throws IOException {
        Path broken = tmp.resolve("broken.json");
        Files.writeString(broken, "{ \"members\": ");
        assertThrows(ConfigReader.ConfigReadException.class, () -> reader.read(broken));
    }

    @Test
    void defaultsWhenNoConfigIsGivenOrFound(@TempDir Path tmp) {
        assertEquals(AnalysisConfig.DEFAULT, reader.readOrDefault(null, tmp).toAnalysisConfig());
        assertEquals(AnalysisConfig.DEFAULT, reader.readOrDefault(null, null).toAnalysisConfig());
    }

    @Test
    void explicitConfigWinsOverSearchDirectory(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve(ConfigReader.DEFAULT_FILE_NAME), "{ \"members\": true }");
        Path explicit = tmp.resolve("other.json");
        Files.writeString(explicit, "{ \"operators\": true }");

        CleanerConfig config = reader.readOrDefault(explicit, tmp);
        assertFalse(config.isMembers());
        assertTrue(config.isOperators());
        assertTrue(reader.readOrDefault(null, tmp).isMembers());
    }
}
