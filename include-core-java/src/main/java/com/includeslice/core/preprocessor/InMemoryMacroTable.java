package com.includeslice.core.preprocessor;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * MacroTable updated as a recorded parse is replayed.
 */
public class InMemoryMacroTable implements MacroTable {

    private final Map<String, MacroInfo> defined = new HashMap<>();
    private final Set<String> everDefined = new HashSet<>();

    public void define(MacroInfo info) {
        defined.put(info.name(), info);
        everDefined.add(info.name());
    }

    public void undefine(String name) {
        defined.remove(name);
    }

    @Override
    public Optional<MacroInfo> getMacroInfo(String name) {
        return Optional.ofNullable(defined.get(name));
    }

    @Override
    public boolean hadMacroDefinition(String name) {
        return everDefined.contains(name);
    }
}
