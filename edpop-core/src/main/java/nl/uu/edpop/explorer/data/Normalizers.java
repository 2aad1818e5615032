package nl.uu.edpop.explorer.data;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.CharMatcher;
import com.google.common.collect.Lists;

/**
 * Normalization strategies shared by the field classes.
 */
public final class Normalizers {

    /**
     * Sets the ISO 639-3 language code of a {@link LanguageField}, accepting as original text an
     * English language name or any ISO 639 code.
     */
    public static final Normalizer<LanguageField> LANGUAGE = new Normalizer<LanguageField>() {

        @Override
        public NormalizationResult normalize(final LanguageField field) {
            final String text = field.getOriginalText().trim();
            if (text.isEmpty()) {
                return NormalizationResult.NO_DATA;
            }
            final String code = Data.languageToCode(text);
            if (code == null) {
                return NormalizationResult.FAIL;
            }
            field.setLanguageCode(code);
            return NormalizationResult.SUCCESS;
        }

    };

    /**
     * Sets the EDTF expression of a {@link DatingField} derived from free-text datings such as
     * {@code 1650}, {@code [ca. 1650]}, {@code 1650?}, {@code 1650-1660}, {@code 1650-60},
     * {@code 165-} or {@code 16--}.
     */
    public static final Normalizer<DatingField> DATING = new Normalizer<DatingField>() {

        @Override
        public NormalizationResult normalize(final DatingField field) {
            final String text = CLEANUP.trimFrom(field.getOriginalText());
            if (text.isEmpty()) {
                return NormalizationResult.NO_DATA;
            }
            final String edtf = toEDTF(text);
            if (edtf == null || !EDTFDate.isValid(edtf)) {
                return NormalizationResult.FAIL;
            }
            field.setEDTF(EDTFDate.parse(edtf));
            return NormalizationResult.SUCCESS;
        }

    };

    private static final CharMatcher CLEANUP = CharMatcher.anyOf("[]().,; ").or(
            CharMatcher.whitespace());

    private static final Pattern APPROXIMATE = Pattern.compile(
            "^(?:(?:ca|circa|c|approx|omstreeks|vers)\\b\\.?\\s*|(?:ca|c)(?=\\d))(.*)$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern YEAR = Pattern.compile("^(\\d{4})(\\?)?$");

    private static final Pattern RANGE = Pattern.compile("^(\\d{4})\\s*[-/]\\s*(\\d{2}|\\d{4})$");

    private static final Pattern DECADE = Pattern.compile("^(\\d{3})-\\??$");

    private static final Pattern CENTURY = Pattern.compile("^(\\d{2})--\\??$");

    private static final Pattern ANY_YEAR = Pattern.compile("(?<!\\d)(\\d{4})(?!\\d)");

    private Normalizers() {
    }

    static String toEDTF(final String text) {
        final Matcher approximate = APPROXIMATE.matcher(text);
        if (approximate.matches()) {
            final String inner = toEDTF(CLEANUP.trimFrom(approximate.group(1)));
            if (inner == null || inner.indexOf('/') >= 0) {
                return inner;
            }
            if (inner.endsWith("?")) {
                return inner.substring(0, inner.length() - 1) + "%";
            }
            return inner.endsWith("~") ? inner : inner + "~";
        }
        Matcher matcher = YEAR.matcher(text);
        if (matcher.matches()) {
            return matcher.group(1) + (matcher.group(2) != null ? "?" : "");
        }
        matcher = RANGE.matcher(text);
        if (matcher.matches()) {
            final String start = matcher.group(1);
            String end = matcher.group(2);
            if (end.length() == 2) {
                end = start.substring(0, 2) + end;
            }
            return start + "/" + end;
        }
        matcher = DECADE.matcher(text);
        if (matcher.matches()) {
            return matcher.group(1) + "X";
        }
        matcher = CENTURY.matcher(text);
        if (matcher.matches()) {
            return matcher.group(1) + "XX";
        }
        final List<String> years = Lists.newArrayList();
        matcher = ANY_YEAR.matcher(text);
        while (matcher.find()) {
            years.add(matcher.group(1));
        }
        return years.size() == 1 ? years.get(0) : null;
    }

}
