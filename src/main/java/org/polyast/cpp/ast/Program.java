package org.polyast.cpp.ast;

import java.util.List;

/**
 * A whole translation unit: the top-level declarations interleaved with preprocessor
 * artifacts, in source order.
 */
public record Program(List<Sequencable<Declaration>> toplevels) {
}
