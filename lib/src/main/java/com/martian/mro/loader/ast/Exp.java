package com.martian.mro.loader.ast;

/** An expression bound to a parameter: a literal value or a reference. */
public sealed interface Exp permits ValExp, RefExp {

    AstNode getNode();
}
