package com.martian.mro.loader.ast;

import java.util.List;

/** A declaration that can be the target of a {@code call} statement. */
public sealed interface Callable extends Dec permits Stage, Pipeline {

    List<InParam> getInParams();

    List<OutParam> getOutParams();
}
