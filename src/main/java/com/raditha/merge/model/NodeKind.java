package com.raditha.merge.model;

/**
 * Closed set of node kinds the merge engine distinguishes.
 * Every operation that depends on the kind switches over all constants.
 */
public enum NodeKind {
    /** Method, constructor, compact constructor or annotation member. */
    DEFINITION,
    /** Class, interface, record, enum or annotation type. */
    TYPE_DECLARATION,
    /** Static or instance initializer block. */
    INITIALIZER,
    /** Method call or object creation statement, optionally with a block lambda. */
    CALL,
    /** {@code if} and {@code switch}. */
    CONDITIONAL,
    /** {@code for}, enhanced {@code for}, {@code while} and {@code do}. */
    LOOP,
    /** {@code try} with its catch and finally clauses. */
    TRY,
    /** Static final fields, interface fields and enum constants. */
    CONSTANT,
    /** Mutable fields, local variable declarations and assignments. */
    VARIABLE,
    /** Statements without identity, such as the empty statement. */
    LITERAL,
    /** A block of comments standing on its own. */
    COMMENT,
    PACKAGE,
    IMPORT,
    /** A freeze region that replaces the nodes it encloses. */
    FREEZE_BLOCK,
    /** Anything else. */
    OTHER;

    /**
     * Lower-case tag used by node typing and CLI options.
     */
    public String tag() {
        return name().toLowerCase();
    }

    public static NodeKind fromTag(String tag) {
        return NodeKind.valueOf(tag.trim().toUpperCase().replace('-', '_'));
    }
}
