package com.includeslice.cli.unit;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public class UnitReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes a unit dump from the given path.
     *
     * @throws UnitReadException if the file is missing, malformed, or has no main file
     */
    public UnitDump.Root read(Path unitPath) {
        if (!Files.exists(unitPath)) {
            throw new UnitReadException("Unit dump not found: " + unitPath);
        }
        UnitDump.Root root;
        try (Reader reader = Files.newBufferedReader(unitPath, StandardCharsets.UTF_8)) {
            root = GSON.fromJson(reader, UnitDump.Root.class);
        } catch (JsonParseException e) {
            throw new UnitReadException("Unit dump is not valid JSON: " + unitPath + ": " + e.getMessage(), e);
        } catch (NoSuchFileException e) {
            throw new UnitReadException("Unit dump not found: " + unitPath, e);
        } catch (IOException e) {
            throw new UnitReadException("Failed to read unit dump: " + unitPath + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new UnitReadException("Unit dump is empty: " + unitPath);
        }
        if (root.mainFile == null) {
            throw new UnitReadException("Unit dump has no main_file: " + unitPath);
        }
        if (root.files == null || root.files.isEmpty()) {
            throw new UnitReadException("Unit dump has no files: " + unitPath);
        }
        return root;
    }

    public static class UnitReadException extends RuntimeException {
        public UnitReadException(String message) { super(message); }
        public UnitReadException(String message, Throwable cause) { super(message, cause); }
    }
}
