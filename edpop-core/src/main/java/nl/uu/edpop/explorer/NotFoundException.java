package nl.uu.edpop.explorer;

/**
 * Signals that a requested record does not exist or could not be located.
 */
public class NotFoundException extends ReaderException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(final String message) {
        super(message);
    }

    public NotFoundException(final String message, final Throwable cause) {
        super(message, cause);
    }

}
