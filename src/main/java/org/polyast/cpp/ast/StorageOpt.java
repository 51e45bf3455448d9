package org.polyast.cpp.ast;

import org.polyast.core.token.Token;
import org.polyast.core.token.Wrap;

public sealed interface StorageOpt {

    record NoSto() implements StorageOpt {}

    record StoTypedef(Token typedefKeyword) implements StorageOpt {}

    record Sto(Wrap<Storage> storage) implements StorageOpt {}

    StorageOpt NONE = new NoSto();
}
