package org.polyast.cpp.ast;

public enum TypeQualifier {
    CONST,
    VOLATILE,
    RESTRICT,
    ATOMIC,
    MUTABLE,
    CONSTEXPR
}
