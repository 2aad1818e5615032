package nl.uu.edpop.explorer.data;

/**
 * A normalization strategy for fields of a certain type.
 * <p>
 * Implementations derive some subfields of a field from its original text. They must be
 * idempotent and should not change anything but the derived subfields.
 * </p>
 * 
 * @param <F>
 *            the type of fields normalized
 */
public interface Normalizer<F extends Field> {

    NormalizationResult normalize(F field);

}
