package org.pragmatica.edn.reader;

import org.pragmatica.edn.error.EdnReadException;
import org.pragmatica.edn.error.ReadError;
import org.pragmatica.edn.tree.CstNode;

import java.util.Optional;

/**
 * Result of reading a document - either the concrete syntax tree or the reason reading failed.
 */
public sealed interface ReadResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The tree root, or empty if reading failed.
     */
    Optional<CstNode> root();

    /**
     * The tree root, or {@link EdnReadException} if reading failed.
     */
    CstNode orElseThrow();

    /**
     * Successful read with the {@link org.pragmatica.edn.tree.NodeKind#ROOT} node.
     */
    record Success(CstNode node) implements ReadResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<CstNode> root() {
            return Optional.of(node);
        }

        @Override
        public CstNode orElseThrow() {
            return node;
        }
    }

    /**
     * Failed read.
     */
    record Failure(ReadError error) implements ReadResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<CstNode> root() {
            return Optional.empty();
        }

        @Override
        public CstNode orElseThrow() {
            throw new EdnReadException(error);
        }
    }
}
