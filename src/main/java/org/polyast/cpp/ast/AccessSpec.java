package org.polyast.cpp.ast;

public enum AccessSpec {
    PUBLIC,
    PRIVATE,
    PROTECTED
}
