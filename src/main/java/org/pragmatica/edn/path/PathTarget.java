package org.pragmatica.edn.path;

/**
 * What a resolved cursor points at.
 */
public enum PathTarget {
    /**
     * A key token inside a map or call form; the value is the next significant sibling.
     */
    KEY,
    /**
     * A sequence element, or a value reached through its key.
     */
    ELEMENT
}
