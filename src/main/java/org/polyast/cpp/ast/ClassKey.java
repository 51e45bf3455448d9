package org.polyast.cpp.ast;

public enum ClassKey {
    STRUCT,
    UNION,
    CLASS
}
