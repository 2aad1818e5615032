package nl.uu.edpop.explorer.data;

/**
 * The outcome of the normalization of a {@link Field}.
 */
public enum NormalizationResult {

    /** The normalized subfields have been set. */
    SUCCESS,

    /** There was nothing to normalize, or the field does not support normalization. */
    NO_DATA,

    /** The original text could not be interpreted. */
    FAIL

}
