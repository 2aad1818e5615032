package nl.uu.edpop.explorer.data;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import nl.uu.edpop.explorer.vocabulary.EDPOPREC;

/**
 * A field holding a date or period. Normalization derives an {@link EDTFDate} from the original
 * text.
 */
public class DatingField extends Field {

    public static final String EDTF = "edtf";

    private Normalizer<DatingField> normalizer;

    public DatingField(final String originalText) throws FieldException {
        super(EDPOPREC.DATING_FIELD, originalText);
        addSubfield(EDTF, EDPOPREC.EDTF, Datatype.EDTF);
        this.normalizer = Normalizers.DATING;
    }

    @Nullable
    public EDTFDate getEDTF() {
        return (EDTFDate) get(EDTF);
    }

    public void setEDTF(@Nullable final EDTFDate edtf) {
        set(EDTF, edtf);
    }

    public void setNormalizer(final Normalizer<DatingField> normalizer) {
        this.normalizer = Preconditions.checkNotNull(normalizer);
    }

    @Override
    public NormalizationResult normalize() {
        return this.normalizer.normalize(this);
    }

    @Override
    @Nullable
    public String getSummaryText() {
        final Object edtf = get(EDTF);
        return edtf == null ? null : edtf.toString();
    }

}
