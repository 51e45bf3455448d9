package org.polyast.python.ast;

import java.util.List;

/**
 * The root of a parse, depending on the mode the source was parsed in.
 */
public sealed interface Mod {

    record Module(List<Stmt> body) implements Mod {}

    record Interactive(List<Stmt> body) implements Mod {}

    record Expression(Expr body) implements Mod {}

    record Suite(List<Stmt> body) implements Mod {}
}
