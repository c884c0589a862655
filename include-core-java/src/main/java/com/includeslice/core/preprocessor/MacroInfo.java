package com.includeslice.core.preprocessor;

import com.includeslice.core.source.SourceLocation;

import java.util.List;

/**
 * One definition of a macro.
 *
 * @param name               macro name
 * @param definitionLocation location of the name in the {@code #define}; invalid for builtins
 * @param params             parameter names of a function-like macro
 * @param tokens             replacement list
 * @param builtin            true for macros such as {@code __FILE__} that the preprocessor implements
 */
public record MacroInfo(
    String name,
    SourceLocation definitionLocation,
    List<String> params,
    List<Token> tokens,
    boolean builtin
) {
    public MacroInfo {
        params = List.copyOf(params);
        tokens = List.copyOf(tokens);
    }

    public static MacroInfo builtin(String name) {
        return new MacroInfo(name, SourceLocation.INVALID, List.of(), List.of(), true);
    }
}
