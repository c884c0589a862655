package com.includeslice.core.syntax;

/**
 * Kinds of named declarations, with the display names the front end reports.
 */
public enum DeclKind {
    FUNCTION("Function"),
    CXX_METHOD("CXXMethod"),
    CXX_CONSTRUCTOR("CXXConstructor"),
    VAR("Var"),
    PARM_VAR("ParmVar"),
    FIELD("Field"),
    RECORD("Record"),
    CXX_RECORD("CXXRecord"),
    ENUM("Enum"),
    ENUM_CONSTANT("EnumConstant"),
    TYPEDEF("Typedef"),
    TYPE_ALIAS("TypeAlias"),
    CLASS_TEMPLATE("ClassTemplate"),
    FUNCTION_TEMPLATE("FunctionTemplate"),
    VAR_TEMPLATE("VarTemplate"),
    NAMESPACE("Namespace"),
    USING("Using"),
    USING_SHADOW("UsingShadow");

    private final String displayName;

    DeclKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() { return displayName; }

    public boolean isTag() {
        return this == RECORD || this == CXX_RECORD || this == ENUM;
    }

    public boolean isFunction() {
        return this == FUNCTION || this == CXX_METHOD || this == CXX_CONSTRUCTOR;
    }

    /** Functions and function templates, i.e. declarations that can name an operator. */
    public boolean isFunctionLike() {
        return isFunction() || this == FUNCTION_TEMPLATE;
    }

    public static DeclKind fromDisplayName(String name) {
        for (DeclKind kind : values()) {
            if (kind.displayName.equals(name)) return kind;
        }
        throw new IllegalArgumentException("Unknown declaration kind: " + name);
    }
}
