package org.polyast.cpp.ast;

/**
 * Storage class specifiers. {@code auto} as a storage class only exists in C; in C++ it
 * is the {@link TypeC.TAuto} type.
 */
public enum Storage {
    AUTO,
    STATIC,
    REGISTER,
    EXTERN,
    INLINE
}
