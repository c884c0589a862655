package com.includeslice.cli.unit;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * POJOs for unit.json: the source table, preprocessor events and syntax tree of one
 * parsed unit, as written by the external front end.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class UnitDump {

    private UnitDump() {}

    public static class Root {
        @SerializedName("dump_version") public String dumpVersion;
        /** Id of the main file's entry in {@code files}. */
        @SerializedName("main_file")    public Integer mainFile;
        @SerializedName("files")        public List<File> files;
        @SerializedName("events")       public List<Event> events;
        @SerializedName("decls")        public List<Decl> decls;
    }

    /** One entry of the source table. Buffers have no path. */
    public static class File {
        @SerializedName("id")              public int id;
        @SerializedName("path")            public String path;        // nullable
        @SerializedName("include_guarded") public boolean includeGuarded;
        @SerializedName("predefines")      public boolean predefines;
    }

    /** A file location, or a macro location when {@code macro} is set. */
    public static class Loc {
        @SerializedName("file")  public int file;
        @SerializedName("line")  public int line;
        @SerializedName("col")   public int col;
        @SerializedName("macro") public MacroLoc macro;
    }

    public static class MacroLoc {
        @SerializedName("spelling")  public Loc spelling;
        @SerializedName("expansion") public Loc expansion;
        @SerializedName("argument")  public boolean argument;
    }

    /**
     * A preprocessor event. {@code kind} is one of
     * file_changed, include, define, undef, expand, comment.
     */
    public static class Event {
        @SerializedName("kind")     public String kind;
        @SerializedName("loc")      public Loc loc;
        @SerializedName("reason")   public String reason;    // file_changed: enter, exit
        @SerializedName("spelled")  public String spelled;   // include, with delimiters
        @SerializedName("resolved") public String resolved;  // include, nullable
        @SerializedName("name")     public String name;      // define, undef, expand
        @SerializedName("params")   public List<String> params;
        @SerializedName("tokens")   public List<MacroToken> tokens;
        @SerializedName("builtin")  public boolean builtin;
        @SerializedName("text")     public String text;      // comment
    }

    public static class MacroToken {
        @SerializedName("spelling")   public String spelling;
        @SerializedName("loc")        public Loc loc;
        @SerializedName("identifier") public boolean identifier;
    }

    public static class Decl {
        @SerializedName("id")             public int id;
        @SerializedName("kind")           public String kind;           // display name, e.g. CXXRecord
        @SerializedName("name")           public String name;
        @SerializedName("qualified_name") public String qualifiedName;  // nullable
        @SerializedName("loc")            public Loc loc;               // nullable for implicit decls
        @SerializedName("definition")     public boolean definition;
        @SerializedName("previous")       public Integer previous;      // nullable
        @SerializedName("friend")         public String friend;         // undeclared, declared
        @SerializedName("specialization") public String specialization; // implicit_instantiation, ...
        @SerializedName("operator")       public boolean operator;
        @SerializedName("shadows")        public List<Integer> shadows; // Using only
        @SerializedName("children")       public List<Node> children;
        @SerializedName("top_level")      public boolean topLevel;
    }

    /**
     * A syntax node. {@code kind} is one of
     * decl_ref, member, overload, construct, call, compound, type_loc, decl.
     */
    public static class Node {
        @SerializedName("kind")    public String kind;
        @SerializedName("loc")     public Loc loc;
        @SerializedName("decl")    public Integer decl;
        @SerializedName("decls")   public List<Integer> decls;
        @SerializedName("member")  public boolean member;
        @SerializedName("base")    public Node base;
        @SerializedName("callee")  public Node callee;
        @SerializedName("args")    public List<Node> args;
        @SerializedName("body")    public List<Node> body;
        @SerializedName("type")    public TypeRef type;
    }

    /**
     * A type. {@code kind} is one of
     * tag, typedef, using, template_specialization, pointer, builtin.
     */
    public static class TypeRef {
        @SerializedName("kind")           public String kind;
        @SerializedName("decl")           public Integer decl;
        @SerializedName("specialization") public Integer specialization;
        @SerializedName("args")           public List<TypeRef> args;
        @SerializedName("pointee")        public TypeRef pointee;
        @SerializedName("name")           public String name;
    }
}
