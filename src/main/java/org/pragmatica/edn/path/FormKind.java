package org.pragmatica.edn.path;

import org.pragmatica.edn.tree.CstNode;
import org.pragmatica.edn.tree.Nodes;

/**
 * Shape of a node as far as path resolution is concerned.
 */
public enum FormKind {
    MAP,
    /**
     * Vector or list.
     */
    SEQUENCE,
    /**
     * List headed by the call-form symbol: positional arguments followed by keyword/value options.
     */
    CALL_FORM,
    SET,
    OTHER;

    public static FormKind of(CstNode node, String callFormHead) {
        if (Nodes.isCallForm(node, callFormHead)) {
            return CALL_FORM;
        }
        if (Nodes.isMap(node)) {
            return MAP;
        }
        if (Nodes.isVector(node) || Nodes.isList(node)) {
            return SEQUENCE;
        }
        if (Nodes.isSet(node)) {
            return SET;
        }
        return OTHER;
    }
}
