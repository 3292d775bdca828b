package com.branchprobe.extractor.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class ConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes an extractor config file.
     *
     * @throws ConfigReadException if the file is missing, malformed, or names an unknown
     *         propagation mode or branch ID scope
     */
    public ExtractorConfig read(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        ExtractorConfig config;
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            config = GSON.fromJson(reader, ExtractorConfig.class);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Config file is not valid JSON: " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigReadException("Config file is empty: " + configPath);
        }
        try {
            config.getPropagationMode();
            config.getBranchIdScope();
        } catch (IllegalArgumentException e) {
            throw new ConfigReadException(configPath + ": " + e.getMessage(), e);
        }
        return config;
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
