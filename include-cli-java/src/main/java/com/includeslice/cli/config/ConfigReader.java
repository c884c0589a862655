package com.includeslice.cli.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public class ConfigReader {

    /** File name looked up next to the unit dump when no --config is given. */
    public static final String DEFAULT_FILE_NAME = "include-slice.json";

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes a config file.
     *
     * @throws ConfigReadException if the file is missing or malformed
     */
    public CleanerConfig read(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            CleanerConfig config = GSON.fromJson(reader, CleanerConfig.class);
            if (config == null) {
                throw new ConfigReadException("Config file is empty: " + configPath);
            }
            return config;
        } catch (JsonParseException e) {
            throw new ConfigReadException("Config file is not valid JSON: " + configPath + ": " + e.getMessage(), e);
        } catch (NoSuchFileException e) {
            throw new ConfigReadException("Config file not found: " + configPath, e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads {@code explicit} if given, else {@value #DEFAULT_FILE_NAME} from {@code searchDir} if present,
     * else returns the defaults.
     */
    public CleanerConfig readOrDefault(Path explicit, Path searchDir) {
        if (explicit != null) return read(explicit);
        if (searchDir != null) {
            Path candidate = searchDir.resolve(DEFAULT_FILE_NAME);
            if (Files.exists(candidate)) return read(candidate);
        }
        return new CleanerConfig();
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
