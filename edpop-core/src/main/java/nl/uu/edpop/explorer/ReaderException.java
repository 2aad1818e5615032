package nl.uu.edpop.explorer;

/**
 * Signals the failure of a {@link Reader} operation.
 * <p>
 * This exception is thrown both for misuse of the reader query state (e.g., changing the query
 * after fetching started) and for failures of the underlying catalog, which are wrapped with
 * their original message and the original exception as cause.
 * </p>
 */
public class ReaderException extends Exception {

    private static final long serialVersionUID = 1L;

    public ReaderException(final String message) {
        super(message);
    }

    public ReaderException(final String message, final Throwable cause) {
        super(message, cause);
    }

}
