package org.pragmatica.edn.tree;

/**
 * Tag carried by every concrete syntax tree node.
 */
public enum NodeKind {
    /**
     * Whole document: top-level forms and the trivia between them.
     */
    ROOT,

    /**
     * {@code {k v ...}}
     */
    MAP,

    /**
     * {@code [a b ...]}
     */
    VECTOR,

    /**
     * {@code (a b ...)} and the function literal {@code #(...)}.
     */
    LIST,

    /**
     * {@code #{a b ...}}
     */
    SET,

    /**
     * Symbolic name such as {@code defproject} or {@code clojure.core/str}.
     */
    SYMBOL,

    /**
     * Keyword token such as {@code :deps} or {@code ::local}.
     */
    KEYWORD,

    /**
     * Self-describing literal text: strings, numbers, characters, regexes,
     * {@code nil}, {@code true}, {@code false} and {@code ##Inf}-style values.
     */
    LITERAL,

    /**
     * Run of spaces, tabs, commas or form feeds.
     */
    WHITESPACE,

    /**
     * Single line break, {@code \n} or {@code \r\n}.
     */
    NEWLINE,

    /**
     * {@code ;} or {@code #!} comment up to (not including) the line break.
     */
    COMMENT,

    /**
     * Opening or closing bracket, or the prefix of a reader macro.
     */
    DELIMITER,

    /**
     * The {@code #name} part of a tagged literal.
     */
    TAG,

    /**
     * Tagged literal: a {@link #TAG} followed by the tagged form.
     */
    TAGGED,

    /**
     * Quote-like reader macro applied to a form: {@code 'x}, {@code `x}, {@code ~x}, {@code ~@x}, {@code @x}, {@code #'x}.
     */
    QUOTED,

    /**
     * Metadata attached to a form: {@code ^meta form}.
     */
    META,

    /**
     * Form suppressed by {@code #_}.
     */
    DISCARD;

    /**
     * Kinds present only for round-trip fidelity; semantic navigation skips them.
     */
    public boolean isInsignificant() {
        return this == WHITESPACE || this == NEWLINE || this == COMMENT || this == DISCARD;
    }

    public boolean isCollection() {
        return this == MAP || this == VECTOR || this == LIST;
    }
}
