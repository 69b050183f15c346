package org.pragmatica.edn.error;

/**
 * Thrown when a caller insists on a successfully read document and reading failed.
 */
public class EdnReadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient ReadError error;

    public EdnReadException(ReadError error) {
        super(error.message());
        this.error = error;
    }

    public ReadError error() {
        return error;
    }
}
