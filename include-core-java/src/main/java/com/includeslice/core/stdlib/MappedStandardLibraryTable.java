package com.includeslice.core.stdlib;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import com.includeslice.core.syntax.NamedDecl;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * StandardLibraryTable backed by a qualified-name map, loaded from a JSON resource:
 * <pre>
 * { "symbols": [ { "name": "std::vector", "header": "&lt;vector&gt;" }, ... ] }
 * </pre>
 * A symbol listed with several headers keeps the first one.
 */
public class MappedStandardLibraryTable implements StandardLibraryTable {

    static final String DEFAULT_RESOURCE = "/stdlib-symbols.json";

    private static final Gson GSON = new Gson();

    private final Map<String, StdlibSymbol> byQualifiedName;
    private final Map<String, StdlibHeader> headersByBareName;

    public MappedStandardLibraryTable(Map<String, StdlibSymbol> byQualifiedName) {
        this.byQualifiedName = Collections.unmodifiableMap(new LinkedHashMap<>(byQualifiedName));
        Map<String, StdlibHeader> headers = new HashMap<>();
        for (StdlibSymbol symbol : byQualifiedName.values()) {
            headers.putIfAbsent(symbol.header().bareName(), symbol.header());
        }
        this.headersByBareName = Collections.unmodifiableMap(headers);
    }

    static MappedStandardLibraryTable fromResource(String resource) {
        InputStream in = MappedStandardLibraryTable.class.getResourceAsStream(resource);
        if (in == null) {
            throw new TableLoadException("Standard library table not found on classpath: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        } catch (IOException e) {
            throw new TableLoadException("Failed to read standard library table: " + resource, e);
        }
    }

    public static MappedStandardLibraryTable fromJson(Reader reader) {
        SymbolsFile file;
        try {
            file = GSON.fromJson(reader, SymbolsFile.class);
        } catch (JsonParseException e) {
            throw new TableLoadException("Malformed standard library table: " + e.getMessage(), e);
        }
        if (file == null || file.symbols == null) {
            throw new TableLoadException("Standard library table is empty");
        }
        Map<String, StdlibSymbol> symbols = new LinkedHashMap<>();
        for (SymbolEntry entry : file.symbols) {
            if (entry.name == null || entry.header == null) {
                throw new TableLoadException("Standard library entry missing name or header: " + entry.name);
            }
            StdlibHeader header;
            try {
                header = new StdlibHeader(entry.header);
            } catch (IllegalArgumentException e) {
                throw new TableLoadException("Bad header for standard library entry " + entry.name + ": "
                    + e.getMessage(), e);
            }
            symbols.putIfAbsent(entry.name, new StdlibSymbol(entry.name, header));
        }
        return new MappedStandardLibraryTable(symbols);
    }

    @Override
    public Optional<StdlibSymbol> recognize(NamedDecl decl) {
        return Optional.ofNullable(byQualifiedName.get(decl.getQualifiedName()));
    }

    @Override
    public Optional<StdlibHeader> header(String spelling) {
        String bare = spelling.startsWith("<") && spelling.endsWith(">")
            ? spelling.substring(1, spelling.length() - 1)
            : spelling;
        return Optional.ofNullable(headersByBareName.get(bare));
    }

    public int size() { return byQualifiedName.size(); }

    private static class SymbolsFile {
        @SerializedName("symbols") List<SymbolEntry> symbols;
    }

    private static class SymbolEntry {
        @SerializedName("name")   String name;
        @SerializedName("header") String header;
    }

    public static class TableLoadException extends RuntimeException {
        public TableLoadException(String message) { super(message); }
        public TableLoadException(String message, Throwable cause) { super(message, cause); }
    }
}
