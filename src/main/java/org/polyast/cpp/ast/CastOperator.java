package org.polyast.cpp.ast;

public enum CastOperator {
    STATIC_CAST,
    DYNAMIC_CAST,
    CONST_CAST,
    REINTERPRET_CAST
}
