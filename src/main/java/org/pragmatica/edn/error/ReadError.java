package org.pragmatica.edn.error;

import org.pragmatica.edn.tree.SourceLocation;

/**
 * Reason an EDN document could not be read, with the location where reading stopped.
 */
public sealed interface ReadError {
    SourceLocation location();

    String message();

    /**
     * Token that cannot appear at this position, e.g. a stray closing bracket.
     */
    record UnexpectedInput(
    SourceLocation location,
    String found,
    String expected) implements ReadError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location + ", expected " + expected;
        }
    }

    /**
     * Input ended inside an unfinished form.
     */
    record UnexpectedEof(
    SourceLocation location,
    String expected) implements ReadError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }
    }

    /**
     * Malformed token reported by the lexer.
     */
    record LexicalError(
    SourceLocation location,
    String reason) implements ReadError {
        @Override
        public String message() {
            return reason + " at " + location;
        }
    }

    /**
     * Input exceeds the configured size limit.
     */
    record InputTooLarge(
    int size,
    int limit) implements ReadError {
        @Override
        public SourceLocation location() {
            return SourceLocation.START;
        }

        @Override
        public String message() {
            return "Input of " + size + " characters exceeds maximum size of " + limit + " characters";
        }
    }

    /**
     * Forms nested deeper than the configured limit.
     */
    record NestingTooDeep(
    SourceLocation location,
    int limit) implements ReadError {
        @Override
        public String message() {
            return "Nesting deeper than " + limit + " levels at " + location;
        }
    }
}
