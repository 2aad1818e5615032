package nl.uu.edpop.explorer.data;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import nl.uu.edpop.explorer.vocabulary.EDPOPREC;

/**
 * A field naming a language. Normalization sets the ISO 639-3 language code; the summary is the
 * English name of the language.
 */
public class LanguageField extends Field {

    public static final String LANGUAGE_CODE = "language_code";

    private Normalizer<LanguageField> normalizer;

    public LanguageField(final String originalText) throws FieldException {
        super(EDPOPREC.LANGUAGE_FIELD, originalText);
        addSubfield(LANGUAGE_CODE, EDPOPREC.LANGUAGE_CODE, Datatype.STRING);
        this.normalizer = Normalizers.LANGUAGE;
    }

    @Nullable
    public String getLanguageCode() {
        return (String) get(LANGUAGE_CODE);
    }

    public void setLanguageCode(@Nullable final String languageCode) {
        set(LANGUAGE_CODE, languageCode);
    }

    public void setNormalizer(final Normalizer<LanguageField> normalizer) {
        this.normalizer = Preconditions.checkNotNull(normalizer);
    }

    @Override
    public NormalizationResult normalize() {
        return this.normalizer.normalize(this);
    }

    @Override
    @Nullable
    public String getSummaryText() {
        final Object code = get(LANGUAGE_CODE);
        return code == null ? null : Data.languageCodeToName(code.toString());
    }

}
