package com.mwpbound.analyzer;

import com.google.gson.Gson;
import com.mwpbound.analyzer.config.AnalysisConfig;
import com.mwpbound.analyzer.config.AnalysisConfigReader;
import com.mwpbound.analyzer.config.AnalysisMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisConfigReaderTest {

    private final AnalysisConfigReader reader = new AnalysisConfigReader();

    @Test
    void readsFixtureConfig() {
        Path fixture = Paths.get(System.getProperty("user.dir"))
            .getParent()
            .resolve("test-fixtures/programs/analysis-config.json");
        AnalysisConfig config = reader.read(fixture);
        assertEquals(AnalysisMode.LOOP, config.getMode());
        assertTrue(config.isFin());
        assertFalse(config.isStrict());
        assertEquals(List.of(0, 1, 2), config.getDomain());
    }

    @Test
    void missingFieldsFallBackToDefaults(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("config.json");
        Files.writeString(file, "{ \"domain\": [0, 1] }");

        AnalysisConfig config = reader.read(file);
        assertEquals(AnalysisMode.FUNCTION, config.getMode());
        assertFalse(config.isFin());
        assertFalse(config.isStrict());
        assertFalse(config.isVerbose());
        assertEquals(List.of(0, 1), config.getDomain());
    }

    @Test
    void defaultsAndCopies() {
        AnalysisConfig defaults = AnalysisConfig.defaults();
        AnalysisConfig strict = defaults.withStrict(true).withMode(AnalysisMode.LOOP);
        assertFalse(defaults.isStrict());
        assertTrue(strict.isStrict());
        assertEquals(AnalysisMode.LOOP, strict.getMode());
        assertEquals(AnalysisMode.FUNCTION, defaults.getMode());
        assertTrue(defaults.withFin(true).isFin());
        assertTrue(defaults.withVerbose(true).isVerbose());
    }

    @Test
    void fileNotFoundThrowsConfigReadException() {
        Path missing = Path.of("/tmp/does-not-exist-config.json");
        assertThrows(AnalysisConfigReader.ConfigReadException.class, () -> reader.read(missing));
    }

    @Test
    void emptyFileThrowsConfigReadException(@TempDir Path tmp) throws IOException {
        Path empty = tmp.resolve("empty.json");
        Files.writeString(empty, "");
        assertThrows(AnalysisConfigReader.ConfigReadException.class, () -> reader.read(empty));
    }

    @Test
    void malformedJsonThrowsConfigReadException(@TempDir Path tmp) throws IOException {
        Path bad = tmp.resolve("bad.json");
        Files.writeString(bad, "{ \"fin\": ");
        assertThrows(AnalysisConfigReader.ConfigReadException.class, () -> reader.read(bad));
    }

    @Test
    void domainOutsideRuleVariantsThrowsConfigReadException(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("config.json");
        Files.writeString(file, "{ \"domain\": [5] }");
        AnalysisConfigReader.ConfigReadException e =
            assertThrows(AnalysisConfigReader.ConfigReadException.class, () -> reader.read(file));
        assertTrue(e.getMessage().contains("domain"));
    }

    @Test
    void domainWithNullOrNoValuesThrowsConfigReadException(@TempDir Path tmp) throws IOException {
        Path withNull = tmp.resolve("null.json");
        Files.writeString(withNull, "{ \"domain\": [0, null] }");
        assertThrows(AnalysisConfigReader.ConfigReadException.class, () -> reader.read(withNull));

        Path empty = tmp.resolve("empty-domain.json");
        Files.writeString(empty, "{ \"domain\": [] }");
        assertThrows(AnalysisConfigReader.ConfigReadException.class, () -> reader.read(empty));
    }

    @Test
    void getDomainRejectsInvalidValues() {
        AnalysisConfig config = new Gson().fromJson("{ \"domain\": [0, 3] }", AnalysisConfig.class);
        assertThrows(IllegalArgumentException.class, config::getDomain);
    }
}
