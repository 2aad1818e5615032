package nl.uu.edpop.explorer.data;

import java.io.Serializable;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * A date or interval in the Extended Date/Time Format (EDTF).
 * <p>
 * The supported subset covers years, year-months and full dates (level 0), unspecified digits
 * using {@code X} (e.g., {@code 165X}, {@code 16XX}, {@code 1650-XX}), the uncertain ({@code ?}),
 * approximate ({@code ~}) and uncertain-and-approximate ({@code %}) qualifiers, and intervals
 * {@code start/end} whose ends may be unknown (empty) or open ({@code ..}). Instances are
 * immutable and compare equal if their textual forms are equal.
 * </p>
 */
public final class EDTFDate implements Serializable, Comparable<EDTFDate> {

    private static final long serialVersionUID = 1L;

    private static final String DATE_REGEX = "(\\d{4}|\\d{3}X|\\d{2}XX)"
            + "(?:-(0[1-9]|1[0-2]|XX)(?:-(0[1-9]|[12]\\d|3[01]|XX))?)?([?~%])?";

    private static final Pattern DATE_PATTERN = Pattern.compile(DATE_REGEX);

    private static final String OPEN = "..";

    private final String text;

    @Nullable
    private final String start;

    @Nullable
    private final String end;

    private EDTFDate(final String text, @Nullable final String start, @Nullable final String end) {
        this.text = text;
        this.start = start;
        this.end = end;
    }

    /**
     * Parses an EDTF string.
     * 
     * @param text
     *            the string to parse
     * @return the parsed date or interval
     * @throws IllegalArgumentException
     *             if the string is not a supported EDTF expression
     */
    public static EDTFDate parse(final String text) throws IllegalArgumentException {
        Preconditions.checkNotNull(text);
        final int index = text.indexOf('/');
        if (index < 0) {
            checkDate(text, text);
            return new EDTFDate(text, text, text);
        }
        final String start = text.substring(0, index);
        final String end = text.substring(index + 1);
        Preconditions.checkArgument(!start.isEmpty() || !end.isEmpty(),
                "Interval without start and end: %s", text);
        if (!start.isEmpty() && !start.equals(OPEN)) {
            checkDate(start, text);
        }
        if (!end.isEmpty() && !end.equals(OPEN)) {
            checkDate(end, text);
        }
        final String startYear = plainYear(start);
        final String endYear = plainYear(end);
        Preconditions.checkArgument(startYear == null || endYear == null
                || startYear.compareTo(endYear) <= 0, "Interval ends before it starts: %s", text);
        return new EDTFDate(text, start.isEmpty() ? null : start, end.isEmpty() ? null : end);
    }

    /**
     * Checks whether a string is a supported EDTF expression.
     * 
     * @param text
     *            the string to check, possibly null
     * @return true if {@link #parse(String)} would succeed
     */
    public static boolean isValid(@Nullable final String text) {
        if (text == null) {
            return false;
        }
        try {
            parse(text);
            return true;
        } catch (final IllegalArgumentException ex) {
            return false;
        }
    }

    private static void checkDate(final String date, final String text) {
        Preconditions.checkArgument(DATE_PATTERN.matcher(date).matches(),
                "Invalid EDTF expression: %s", text);
    }

    @Nullable
    private static String plainYear(final String date) {
        final Matcher matcher = DATE_PATTERN.matcher(date);
        if (matcher.matches() && matcher.group(1).indexOf('X') < 0) {
            return matcher.group(1);
        }
        return null;
    }

    /**
     * Returns whether this value is an interval.
     * 
     * @return true for intervals, false for single dates
     */
    public boolean isInterval() {
        return this.text.indexOf('/') >= 0;
    }

    /**
     * Returns the start of the interval, or the date itself for single dates.
     * 
     * @return the start, {@code ..} if open, or null if unknown
     */
    @Nullable
    public String getStart() {
        return this.start;
    }

    /**
     * Returns the end of the interval, or the date itself for single dates.
     * 
     * @return the end, {@code ..} if open, or null if unknown
     */
    @Nullable
    public String getEnd() {
        return this.end;
    }

    @Override
    public int compareTo(final EDTFDate other) {
        return this.text.compareTo(other.text);
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof EDTFDate)) {
            return false;
        }
        return this.text.equals(((EDTFDate) object).text);
    }

    @Override
    public int hashCode() {
        return this.text.hashCode();
    }

    @Override
    public String toString() {
        return this.text;
    }

}
