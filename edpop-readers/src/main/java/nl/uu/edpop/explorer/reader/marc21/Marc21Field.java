package nl.uu.edpop.explorer.reader.marc21;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import com.google.common.io.CharStreams;
import com.google.common.io.Resources;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nl.uu.edpop.explorer.internal.Util;

/**
 * A data field of a MARC21 record: a three-character tag, two indicators and an ordered list of
 * subfields, each identified by a one-character code. Subfield codes may repeat.
 */
public final class Marc21Field {

    private static final Logger LOGGER = LoggerFactory.getLogger(Marc21Field.class);

    private static final String DESCRIPTIONS_RESOURCE = "marc21-fields.csv";

    private static final Map<String, String> DESCRIPTIONS = loadDescriptions();

    private final String tag;

    private final String indicator1;

    private final String indicator2;

    private final ListMultimap<String, String> subfields;

    public Marc21Field(final String tag, @Nullable final String indicator1,
            @Nullable final String indicator2, final ListMultimap<String, String> subfields) {
        this.tag = Preconditions.checkNotNull(tag);
        this.indicator1 = indicator1 == null ? " " : indicator1;
        this.indicator2 = indicator2 == null ? " " : indicator2;
        this.subfields = ImmutableListMultimap.copyOf(subfields);
    }

    public String getTag() {
        return this.tag;
    }

    public String getIndicator1() {
        return this.indicator1;
    }

    public String getIndicator2() {
        return this.indicator2;
    }

    public ListMultimap<String, String> getSubfields() {
        return this.subfields;
    }

    /**
     * Returns the first occurrence of a subfield.
     * 
     * @param code
     *            the subfield code
     * @return the subfield value, or null if the subfield does not occur
     */
    @Nullable
    public String getSubfield(final String code) {
        final List<String> values = this.subfields.get(code);
        return values.isEmpty() ? null : values.get(0);
    }

    /**
     * Returns the human-readable description of the field tag, if known.
     * 
     * @return the description, or null
     */
    @Nullable
    public String getDescription() {
        return DESCRIPTIONS.get(this.tag);
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Marc21Field)) {
            return false;
        }
        final Marc21Field other = (Marc21Field) object;
        return this.tag.equals(other.tag) && this.indicator1.equals(other.indicator1)
                && this.indicator2.equals(other.indicator2)
                && this.subfields.equals(other.subfields);
    }

    @Override
    public int hashCode() {
        return this.tag.hashCode() * 37 + this.subfields.hashCode();
    }

    /**
     * {@inheritDoc} Returns the usual MARC21 representation of the field, e.g.
     * {@code 245 (Title Statement): 1 0 $a Title  $c Author}. Blank indicators are rendered as
     * {@code #}.
     */
    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder(this.tag);
        final String description = getDescription();
        if (description != null) {
            builder.append(" (").append(description).append(")");
        }
        builder.append(": ").append(indicatorToString(this.indicator1));
        builder.append(' ').append(indicatorToString(this.indicator2)).append(' ');
        String separator = "";
        for (final Map.Entry<String, String> entry : this.subfields.entries()) {
            builder.append(separator).append('$').append(entry.getKey()).append(' ')
                    .append(entry.getValue());
            separator = "  ";
        }
        return builder.toString();
    }

    private static String indicatorToString(final String indicator) {
        return indicator.trim().isEmpty() ? "#" : indicator;
    }

    private static Map<String, String> loadDescriptions() {
        final ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        final URL url = Marc21Field.class.getResource(DESCRIPTIONS_RESOURCE);
        if (url == null) {
            LOGGER.warn("Missing MARC21 field descriptions: " + DESCRIPTIONS_RESOURCE);
            return builder.build();
        }
        Reader reader = null;
        try {
            reader = new InputStreamReader(Resources.asByteSource(url).openStream(),
                    StandardCharsets.UTF_8);
            boolean header = true;
            for (final String line : CharStreams.readLines(reader)) {
                if (header || line.trim().isEmpty()) {
                    header = false;
                    continue;
                }
                final List<String> tokens = Splitter.on(',').limit(2).trimResults()
                        .splitToList(line);
                if (tokens.size() == 2) {
                    builder.put(tokens.get(0), unquote(tokens.get(1)));
                }
            }
        } catch (final IOException ex) {
            LOGGER.warn("Could not load MARC21 field descriptions", ex);
        } finally {
            Util.closeQuietly(reader);
        }
        return builder.build();
    }

    private static String unquote(final String string) {
        if (string.length() >= 2 && string.startsWith("\"") && string.endsWith("\"")) {
            return string.substring(1, string.length() - 1).replace("\"\"", "\"");
        }
        return string;
    }

}
