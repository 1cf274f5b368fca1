package com.martian.mro.loader.ast;

/** A top-level declaration: a file type, a stage or a pipeline. */
public sealed interface Dec permits UserType, Callable {

    AstNode getNode();

    String getId();
}
