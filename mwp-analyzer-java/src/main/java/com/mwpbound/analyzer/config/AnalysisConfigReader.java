package com.mwpbound.analyzer.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.file.Path;

public class AnalysisConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes an analysis configuration from the given path.
     *
     * @throws ConfigReadException if the file is missing, malformed or names an invalid domain
     */
    public AnalysisConfig read(Path configPath) {
        if (!configPath.toFile().exists()) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        try (FileReader reader = new FileReader(configPath.toFile())) {
            AnalysisConfig config = GSON.fromJson(reader, AnalysisConfig.class);
            if (config == null) {
                throw new ConfigReadException("Config file is empty or invalid JSON: " + configPath);
            }
            config.getDomain(); // rejects an invalid domain
            return config;
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new ConfigReadException("Invalid config " + configPath + ": " + e.getMessage(), e);
        } catch (FileNotFoundException e) {
            throw new ConfigReadException("Config file not found: " + configPath, e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
