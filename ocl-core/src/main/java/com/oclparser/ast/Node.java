package com.oclparser.ast;

/**
 * Base interface for all OCL AST nodes.
 *
 * <p>Every node other than the {@link Document} has an id that indexes the document's node arena.
 * The parent is recorded as the arena id of the owning node rather than as a reference, so the tree
 * has no cycles. Top-level members, and the document itself, report {@link #NO_PARENT}.</p>
 */
public sealed interface Node permits
    Document,
    Member,
    Value {

    int NO_PARENT = -1;

    String type();
    int id();
    int parent();
    int start();
    int end();
    SourceLocation loc();
}
