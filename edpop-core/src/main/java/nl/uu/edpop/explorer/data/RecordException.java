package nl.uu.edpop.explorer.data;

import javax.annotation.Nullable;

/**
 * Signals a malformed {@link Record} or the failure of the deferred retrieval of a lazy record.
 * <p>
 * This exception is thrown when a field registry entry does not refer to a {@link Field} class,
 * when a registered attribute holds an object that is not an instance of the declared field
 * class, or when a {@link LazyRecord} cannot be fetched.
 * </p>
 */
public class RecordException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RecordException(final String message) {
        super(message);
    }

    public RecordException(final String message, @Nullable final Throwable cause) {
        super(message, cause);
    }

}
