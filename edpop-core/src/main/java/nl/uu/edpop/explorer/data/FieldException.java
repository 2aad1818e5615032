package nl.uu.edpop.explorer.data;

import javax.annotation.Nullable;

/**
 * Signals a malformed {@link Field}.
 * <p>
 * This exception is thrown when a field is constructed without original text, or when the
 * serialization of a field finds a subfield declared with an unknown datatype or holding a value
 * not matching its declared datatype. It is never recovered from silently: the serialization of
 * the field (and of the enclosing record) is aborted.
 * </p>
 */
public class FieldException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FieldException(final String message) {
        super(message);
    }

    public FieldException(final String message, @Nullable final Throwable cause) {
        super(message, cause);
    }

}
