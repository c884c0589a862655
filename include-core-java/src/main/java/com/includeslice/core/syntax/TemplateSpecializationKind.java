package com.includeslice.core.syntax;

public enum TemplateSpecializationKind {
    NONE,
    IMPLICIT_INSTANTIATION,
    EXPLICIT_SPECIALIZATION,
    EXPLICIT_INSTANTIATION
}
