package com.latex.jdbc.loader.ast;

/** A parsed element that can belong to a document section: a command or an environment. */
public sealed interface LatexNode permits Command, Environment {

    SourceLocation getLocation();

    String getName();
}
