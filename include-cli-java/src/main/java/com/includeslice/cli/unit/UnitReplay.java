package com.includeslice.cli.unit;

import com.includeslice.cli.unit.UnitReader.UnitReadException;
import com.includeslice.core.analysis.AnalysisConfig;
import com.includeslice.core.analysis.AnalysisContext;
import com.includeslice.core.analysis.RecordedAst;
import com.includeslice.core.analysis.RecordedPreprocessor;
import com.includeslice.core.analysis.UnusedIncludeFinder;
import com.includeslice.core.preprocessor.FileChangeReason;
import com.includeslice.core.preprocessor.InMemoryMacroTable;
import com.includeslice.core.preprocessor.MacroInfo;
import com.includeslice.core.preprocessor.PreprocessorListener;
import com.includeslice.core.preprocessor.Token;
import com.includeslice.core.source.FileEntry;
import com.includeslice.core.source.FileId;
import com.includeslice.core.source.InMemorySourceManager;
import com.includeslice.core.source.MacroExpansion;
import com.includeslice.core.source.SourceLocation;
import com.includeslice.core.stdlib.StandardLibraryTable;
import com.includeslice.core.syntax.CallExpr;
import com.includeslice.core.syntax.CompoundStmt;
import com.includeslice.core.syntax.ConstructExpr;
import com.includeslice.core.syntax.DeclKind;
import com.includeslice.core.syntax.DeclRefExpr;
import com.includeslice.core.syntax.FriendKind;
import com.includeslice.core.syntax.MemberExpr;
import com.includeslice.core.syntax.NamedDecl;
import com.includeslice.core.syntax.Node;
import com.includeslice.core.syntax.OverloadExpr;
import com.includeslice.core.syntax.TemplateSpecializationKind;
import com.includeslice.core.syntax.TopLevelDeclListener;
import com.includeslice.core.syntax.Type;
import com.includeslice.core.syntax.TypeLoc;
import com.includeslice.core.syntax.UsingDecl;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A front end that replays a recorded parse: it rebuilds the source table and syntax tree
 * from a unit dump, then feeds the preprocessor events and top-level declarations to the
 * analysis listeners in the order the parser produced them.
 */
public class UnitReplay {

    private final UnitDump.Root dump;
    private final InMemorySourceManager sourceManager = new InMemorySourceManager();
    private final InMemoryMacroTable macroTable = new InMemoryMacroTable();
    private final Map<Integer, FileId> fileIds = new HashMap<>();
    private final Map<Integer, NamedDecl> decls = new LinkedHashMap<>();
    private final String mainFile;
    private boolean replayed;

    private UnitReplay(UnitDump.Root dump) {
        this.dump = dump;
        this.mainFile = loadFiles();
        loadDecls();
    }

    /**
     * Rebuilds the source table and syntax tree of {@code dump}.
     *
     * @throws UnitReadException if the dump is inconsistent
     */
    public static UnitReplay load(UnitDump.Root dump) {
        return new UnitReplay(dump);
    }

    public InMemorySourceManager sourceManager() { return sourceManager; }
    public InMemoryMacroTable macroTable()       { return macroTable; }
    public String mainFile()                     { return mainFile; }

    /** Number of declarations in the rebuilt tree. */
    public int declCount() { return decls.size(); }

    /** Replays the unit into a fresh analysis and classifies its includes. */
    public AnalyzedUnit analyze(AnalysisConfig config, StandardLibraryTable stdlib) {
        AnalysisContext ctx = new AnalysisContext(config.policy(), sourceManager, macroTable, stdlib);
        RecordedPreprocessor pp = new RecordedPreprocessor();
        RecordedAst ast = new RecordedAst();
        replay(pp.record(ctx), ast.record(ctx));
        return new AnalyzedUnit(mainFile, sourceManager, config,
            new UnusedIncludeFinder(config).analyze(ctx, ast, pp));
    }

    /**
     * Delivers the preprocessor events in order, then each top-level declaration.
     * The macro table is updated as definitions are replayed, so a unit can be replayed once.
     */
    public void replay(PreprocessorListener pp, TopLevelDeclListener ast) {
        if (replayed) {
            throw new IllegalStateException("Unit already replayed: " + mainFile);
        }
        replayed = true;

        List<UnitDump.Event> events = dump.events != null ? dump.events : List.of();
        for (UnitDump.Event event : events) {
            replayEvent(event, pp);
        }

        List<UnitDump.Decl> dumped = dump.decls != null ? dump.decls : List.of();
        for (UnitDump.Decl decl : dumped) {
            if (!decl.topLevel) continue;
            if (!ast.handleTopLevelDecl(List.of(decls.get(decl.id)))) break;
        }
    }

    // --- Source table ---

    private String loadFiles() {
        if (dump.mainFile == null || dump.files == null) {
            throw new UnitReadException("Unit dump needs main_file and files");
        }
        String mainPath = null;
        for (UnitDump.File file : dump.files) {
            if (fileIds.containsKey(file.id)) {
                throw new UnitReadException("Duplicate file id " + file.id);
            }
            FileId id;
            if (file.predefines) {
                id = sourceManager.addPredefines();
            } else if (file.path == null) {
                id = sourceManager.addBuffer();
            } else if (file.id == dump.mainFile) {
                id = sourceManager.addMainFile(file.path);
                mainPath = file.path;
            } else {
                id = sourceManager.addFile(file.path, file.includeGuarded);
            }
            fileIds.put(file.id, id);
        }
        if (mainPath == null) {
            throw new UnitReadException("main_file " + dump.mainFile + " is not a file with a path");
        }
        return mainPath;
    }

    private SourceLocation loc(UnitDump.Loc loc) {
        if (loc == null) return SourceLocation.INVALID;
        if (loc.macro != null) {
            return SourceLocation.inMacro(new MacroExpansion(
                loc(loc.macro.spelling), loc(loc.macro.expansion), loc.macro.argument));
        }
        FileId file = fileIds.get(loc.file);
        if (file == null) {
            throw new UnitReadException("Location refers to unknown file id " + loc.file);
        }
        return SourceLocation.of(file, loc.line, loc.col);
    }

    // --- Preprocessor events ---

    private void replayEvent(UnitDump.Event event, PreprocessorListener pp) {
        String kind = event.kind == null ? "<missing>" : event.kind;
        switch (kind) {
            case "file_changed" -> pp.fileChanged(loc(event.loc), fileChangeReason(event.reason));
            case "include" -> pp.inclusionDirective(loc(event.loc), require(event.spelled, "spelled", kind),
                resolvedFile(event.resolved));
            case "define" -> {
                String name = require(event.name, "name", kind);
                List<Token> tokens = new ArrayList<>();
                if (event.tokens != null) {
                    for (UnitDump.MacroToken token : event.tokens) {
                        tokens.add(new Token(token.spelling, loc(token.loc), token.identifier));
                    }
                }
                SourceLocation at = loc(event.loc);
                MacroInfo info = new MacroInfo(name, at,
                    event.params != null ? event.params : List.of(), tokens, event.builtin);
                macroTable.define(info);
                pp.macroDefined(Token.identifier(name, at), info);
            }
            case "undef" -> macroTable.undefine(require(event.name, "name", kind));
            case "expand" -> {
                String name = require(event.name, "name", kind);
                MacroInfo info = macroTable.getMacroInfo(name).orElse(null);
                if (info == null) {
                    if (!event.builtin) {
                        throw new UnitReadException("Expansion of undefined macro " + name);
                    }
                    info = MacroInfo.builtin(name);
                }
                pp.macroExpands(Token.identifier(name, loc(event.loc)), info);
            }
            case "comment" -> pp.comment(loc(event.loc), require(event.text, "text", kind));
            default -> throw new UnitReadException("Unknown event kind: " + kind);
        }
    }

    private static FileChangeReason fileChangeReason(String reason) {
        if ("enter".equals(reason)) return FileChangeReason.ENTER_FILE;
        if ("exit".equals(reason)) return FileChangeReason.EXIT_FILE;
        throw new UnitReadException("Unknown file change reason: " + reason);
    }

    private FileEntry resolvedFile(String path) {
        if (path == null) return null;
        return sourceManager.findFile(path)
            .orElseThrow(() -> new UnitReadException("Include resolves to a file not in the source table: " + path));
    }

    private static <T> T require(T value, String field, String kind) {
        if (value == null) {
            throw new UnitReadException(kind + " is missing " + field);
        }
        return value;
    }

    // --- Syntax tree ---

    private void loadDecls() {
        if (dump.decls == null) return;
        // Redeclarations link to earlier ones; using-declarations may name any declaration.
        for (UnitDump.Decl decl : dump.decls) {
            if (!DeclKind.USING.displayName().equals(decl.kind)) register(decl, buildDecl(decl));
        }
        for (UnitDump.Decl decl : dump.decls) {
            if (!DeclKind.USING.displayName().equals(decl.kind)) continue;
            List<NamedDecl> targets = new ArrayList<>();
            if (decl.shadows != null) {
                for (Integer shadow : decl.shadows) targets.add(declRef(shadow));
            }
            register(decl, UsingDecl.of(decl.name, loc(decl.loc), targets));
        }
        for (UnitDump.Decl decl : dump.decls) {
            NamedDecl built = decls.get(decl.id);
            if (decl.children == null) continue;
            for (UnitDump.Node child : decl.children) {
                built.addChild(node(child));
            }
        }
    }

    private void register(UnitDump.Decl dumped, NamedDecl decl) {
        if (decls.putIfAbsent(dumped.id, decl) != null) {
            throw new UnitReadException("Duplicate decl id " + dumped.id);
        }
    }

    private NamedDecl buildDecl(UnitDump.Decl decl) {
        NamedDecl.Builder builder;
        try {
            builder = NamedDecl.builder(DeclKind.fromDisplayName(decl.kind), require(decl.name, "name", "decl"));
            if (decl.friend != null) {
                builder.friend(FriendKind.valueOf(decl.friend.toUpperCase(Locale.ROOT)));
            }
            if (decl.specialization != null) {
                builder.specialization(TemplateSpecializationKind.valueOf(decl.specialization.toUpperCase(Locale.ROOT)));
            }
        } catch (IllegalArgumentException e) {
            throw new UnitReadException("Decl " + decl.id + ": " + e.getMessage(), e);
        }
        builder.qualifiedName(decl.qualifiedName)
            .at(loc(decl.loc))
            .definition(decl.definition)
            .overloadedOperator(decl.operator);
        if (decl.previous != null) {
            NamedDecl previous = decls.get(decl.previous);
            if (previous == null) {
                throw new UnitReadException("Decl " + decl.id + ": previous declaration "
                    + decl.previous + " must be listed before it");
            }
            builder.previous(previous);
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new UnitReadException("Decl " + decl.id + ": " + e.getMessage(), e);
        }
    }

    private NamedDecl declRef(Integer id) {
        if (id == null) return null;
        NamedDecl decl = decls.get(id);
        if (decl == null) {
            throw new UnitReadException("Reference to unknown decl id " + id);
        }
        return decl;
    }

    private Node node(UnitDump.Node node) {
        String kind = node.kind == null ? "<missing>" : node.kind;
        return switch (kind) {
            case "decl_ref" -> new DeclRefExpr(loc(node.loc), declRef(node.decl));
            case "member" -> new MemberExpr(loc(node.loc), declRef(node.decl),
                node.base == null ? null : node(node.base));
            case "overload" -> new OverloadExpr(loc(node.loc), declRefs(node.decls), node.member);
            case "construct" -> new ConstructExpr(loc(node.loc), type(node.type), nodes(node.args));
            case "call" -> new CallExpr(loc(node.loc), node.callee == null ? null : node(node.callee),
                nodes(node.args));
            case "compound" -> new CompoundStmt(loc(node.loc), nodes(node.body));
            case "type_loc" -> new TypeLoc(loc(node.loc), type(node.type));
            case "decl" -> require(declRef(node.decl), "decl", kind);
            default -> throw new UnitReadException("Unknown node kind: " + kind);
        };
    }

    private List<Node> nodes(List<UnitDump.Node> dumped) {
        List<Node> result = new ArrayList<>();
        if (dumped != null) {
            for (UnitDump.Node node : dumped) result.add(node(node));
        }
        return result;
    }

    private List<NamedDecl> declRefs(List<Integer> ids) {
        List<NamedDecl> result = new ArrayList<>();
        if (ids != null) {
            for (Integer id : ids) result.add(declRef(id));
        }
        return result;
    }

    private Type type(UnitDump.TypeRef type) {
        if (type == null) {
            throw new UnitReadException("Missing type");
        }
        String kind = type.kind == null ? "<missing>" : type.kind;
        return switch (kind) {
            case "tag" -> new Type.TagType(declRef(type.decl));
            case "typedef" -> new Type.TypedefType(declRef(type.decl));
            case "using" -> new Type.UsingType(declRef(type.decl));
            case "template_specialization" -> {
                List<Type> args = new ArrayList<>();
                if (type.args != null) {
                    for (UnitDump.TypeRef arg : type.args) args.add(type(arg));
                }
                yield new Type.TemplateSpecializationType(declRef(type.decl), declRef(type.specialization), args);
            }
            case "pointer" -> new Type.PointerType(type(type.pointee));
            case "builtin" -> new Type.BuiltinType(type.name);
            default -> throw new UnitReadException("Unknown type kind: " + kind);
        };
    }
}
