package nl.uu.edpop.explorer.data;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UnsupportedEncodingException;
import java.net.URL;
import java.net.URLDecoder;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import javax.annotation.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Ascii;
import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.escape.Escaper;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.common.io.Resources;
import com.google.common.net.PercentEscaper;

import org.openrdf.model.Model;
import org.openrdf.model.Statement;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.LinkedHashModel;
import org.openrdf.model.impl.ValueFactoryImpl;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.model.vocabulary.XMLSchema;
import org.openrdf.rio.RDFFormat;
import org.openrdf.rio.RDFHandlerException;
import org.openrdf.rio.RDFWriter;
import org.openrdf.rio.Rio;

import nl.uu.edpop.explorer.vocabulary.EDPOPREC;
import nl.uu.edpop.explorer.vocabulary.SDO;

/**
 * Helper services for working with records, fields and their RDF rendering.
 * <p>
 * The following services are offered:
 * </p>
 * <ul>
 * <li><b>Factories for value objects</b>. Method {@link #getValueFactory()} returns the singleton
 * {@code ValueFactory} used for all the URIs, blank nodes and literals created by this library;
 * method {@link #newModel()} returns an empty graph with the common prefixes bound.</li>
 * <li><b>Prefix-to-namespace mappings</b>. Method {@link #getNamespaceMap()} returns the
 * prefix-to-namespace bindings that are set on every produced graph (rdf, rdfs, xsd, edpoprec,
 * schema).</li>
 * <li><b>IRI components</b>. Methods {@link #encodeIRIComponent(String)} and
 * {@link #decodeIRIComponent(String)} percent-encode and decode identifiers so that they can be
 * appended to an IRI prefix and recovered from it.</li>
 * <li><b>Hashing</b>. Method {@link #hash(Object...)} computes a short alphanumeric hash of a
 * list of objects, used to mint stable IRIs for field values.</li>
 * <li><b>Languages</b>. Methods {@link #languageToCode(String)} and
 * {@link #languageCodeToName(String)} map between language names, ISO 639 codes of any part and
 * the ISO 639-3 codes used in normalized language fields.</li>
 * <li><b>Rendering</b>. Methods {@link #toJSON(Object)}, {@link #write(Model, RDFFormat,
 * OutputStream)} and {@link #toString(Model)} render raw data and graphs.</li>
 * </ul>
 */
public final class Data {

    private static final ValueFactory VALUE_FACTORY = ValueFactoryImpl.getInstance();

    private static final Map<String, String> COMMON_NAMESPACES = ImmutableMap.of(
            RDF.PREFIX, RDF.NAMESPACE, RDFS.PREFIX, RDFS.NAMESPACE, "xsd",
            XMLSchema.NAMESPACE, EDPOPREC.PREFIX, EDPOPREC.NAMESPACE, SDO.PREFIX, SDO.NAMESPACE);

    private static final Escaper IRI_COMPONENT_ESCAPER = new PercentEscaper("-_.~/", false);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final String HASH_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ"
            + "abcdefghijklmnopqrstuvwxyz0123456789";

    private static final String LANGUAGES_RESOURCE = "languages.csv";

    private static final Map<String, String> LANGUAGE_CODES;

    private static final Map<String, String> LANGUAGE_NAMES;

    static {
        // bibliographic ISO 639-2/B codes differing from the terminologic ones
        final Map<String, String> bibliographic = ImmutableMap.<String, String>builder()
                .put("alb", "sqi").put("arm", "hye").put("baq", "eus").put("bur", "mya")
                .put("chi", "zho").put("cze", "ces").put("dut", "nld").put("fre", "fra")
                .put("geo", "kat").put("ger", "deu").put("gre", "ell").put("ice", "isl")
                .put("mac", "mkd").put("mao", "mri").put("may", "msa").put("per", "fas")
                .put("rum", "ron").put("slo", "slk").put("tib", "bod").put("wel", "cym")
                .build();
        final Map<String, String> codes = Maps.newHashMap();
        final Map<String, String> names = Maps.newHashMap();
        for (final String language : Locale.getISOLanguages()) {
            final Locale locale = new Locale(language);
            final String code3;
            try {
                code3 = locale.getISO3Language();
            } catch (final RuntimeException ex) {
                continue; // no 3-letter code available
            }
            final String name = locale.getDisplayLanguage(Locale.ENGLISH);
            codes.put(language, code3);
            codes.put(code3, code3);
            codes.put(Ascii.toLowerCase(name), code3);
            names.put(code3, name);
        }
        for (final Map.Entry<String, String> entry : loadLanguages().entrySet()) {
            final String code = entry.getKey();
            final String name = entry.getValue();
            if (names.containsKey(code)) {
                continue;
            }
            names.put(code, name);
            codes.put(code, code);
            final String key = Ascii.toLowerCase(name);
            if (!codes.containsKey(key)) {
                codes.put(key, code);
            }
            final int index = key.indexOf(" (");
            if (index > 0 && !codes.containsKey(key.substring(0, index))) {
                codes.put(key.substring(0, index), code); // name without qualifier
            }
        }
        for (final Map.Entry<String, String> entry : bibliographic.entrySet()) {
            if (names.containsKey(entry.getValue())) {
                codes.put(entry.getKey(), entry.getValue());
            }
        }
        LANGUAGE_CODES = ImmutableMap.copyOf(codes);
        LANGUAGE_NAMES = ImmutableMap.copyOf(names);
    }

    private Data() {
    }

    private static Map<String, String> loadLanguages() {
        final URL url = Data.class.getResource(LANGUAGES_RESOURCE);
        if (url == null) {
            throw new Error("Missing resource " + LANGUAGES_RESOURCE);
        }
        final Map<String, String> languages = Maps.newLinkedHashMap();
        try {
            boolean header = true;
            for (final String line : Resources.readLines(url, Charsets.UTF_8)) {
                if (header || line.trim().isEmpty()) {
                    header = false;
                    continue;
                }
                final List<String> tokens = Splitter.on(',').limit(2).trimResults()
                        .splitToList(line);
                if (tokens.size() == 2) {
                    languages.put(Ascii.toLowerCase(tokens.get(0)), tokens.get(1));
                }
            }
        } catch (final IOException ex) {
            throw new Error("Cannot read resource " + LANGUAGES_RESOURCE + ": "
                    + ex.getMessage(), ex);
        }
        return languages;
    }

    /**
     * Returns the singleton {@code ValueFactory} used to create URIs, blank nodes and literals.
     * 
     * @return the value factory
     */
    public static ValueFactory getValueFactory() {
        return VALUE_FACTORY;
    }

    /**
     * Returns the prefix-to-namespace bindings applied to every graph created by
     * {@link #newModel()}.
     * 
     * @return an immutable prefix-to-namespace map
     */
    public static Map<String, String> getNamespaceMap() {
        return COMMON_NAMESPACES;
    }

    /**
     * Creates a new, empty graph preserving insertion order, with the common prefixes bound.
     * 
     * @return the created graph
     */
    public static Model newModel() {
        final Model model = new LinkedHashModel();
        for (final Map.Entry<String, String> entry : COMMON_NAMESPACES.entrySet()) {
            model.setNamespace(entry.getKey(), entry.getValue());
        }
        return model;
    }

    /**
     * Percent-encodes a string so that it can be appended to an IRI prefix. Unreserved
     * characters and {@code /} are kept; space is encoded as {@code %20}.
     * 
     * @param component
     *            the string to encode, not null
     * @return the encoded string
     */
    public static String encodeIRIComponent(final String component) {
        return IRI_COMPONENT_ESCAPER.escape(Preconditions.checkNotNull(component));
    }

    /**
     * Decodes a string produced by {@link #encodeIRIComponent(String)}. Character {@code +} is
     * taken literally.
     * 
     * @param component
     *            the string to decode, not null
     * @return the decoded string
     * @throws IllegalArgumentException
     *             if the string contains a malformed escape sequence
     */
    public static String decodeIRIComponent(final String component)
            throws IllegalArgumentException {
        try {
            return URLDecoder.decode(component.replace("+", "%2B"), "UTF-8");
        } catch (final UnsupportedEncodingException ex) {
            throw new Error("UTF-8 not supported (!)", ex);
        }
    }

    /**
     * Hashes a sequence of values to a short identifier usable in IRIs: 16 characters
     * {@code A-Za-z0-9}, the first being a letter. Values are hashed through their string form;
     * null is distinct from the empty string.
     * 
     * @param objects
     *            the values to hash
     * @return the hash string
     */
    public static String hash(final Object... objects) {
        final Hasher hasher = Hashing.sha256().newHasher();
        for (final Object object : objects) {
            if (object == null) {
                hasher.putBoolean(false);
            } else {
                final String string = object.toString();
                hasher.putBoolean(true).putInt(string.length()).putString(string,
                        Charsets.UTF_8);
            }
        }
        final byte[] bytes = hasher.hash().asBytes();
        final char[] chars = new char[16];
        for (int i = 0; i < chars.length; ++i) {
            final int n = bytes[i] & 0xFF;
            chars[i] = HASH_ALPHABET.charAt(i == 0 ? n % 52 : n % HASH_ALPHABET.length());
        }
        return new String(chars);
    }

    /**
     * Returns the ISO 639-3 code for a language name (in English) or an ISO 639-1, 639-2/B or
     * 639-2/T code. Matching is case-insensitive and ignores surrounding whitespace.
     * 
     * @param language
     *            the language name or code, possibly null
     * @return the ISO 639-3 code, or null if the language is not recognized
     */
    @Nullable
    public static String languageToCode(@Nullable final String language) {
        if (language == null) {
            return null;
        }
        return LANGUAGE_CODES.get(Ascii.toLowerCase(language.trim()));
    }

    /**
     * Returns the English name of the language with the ISO 639-3 code specified.
     * 
     * @param code
     *            the ISO 639-3 code, possibly null
     * @return the English language name, or null if the code is unknown
     */
    @Nullable
    public static String languageCodeToName(@Nullable final String code) {
        return code == null ? null : LANGUAGE_NAMES.get(code);
    }

    /**
     * Renders a raw data object (a map, list or scalar) as a JSON string.
     * 
     * @param object
     *            the object to render
     * @return the JSON string
     * @throws IllegalArgumentException
     *             if the object cannot be rendered as JSON
     */
    public static String toJSON(@Nullable final Object object) throws IllegalArgumentException {
        try {
            return OBJECT_MAPPER.writeValueAsString(object);
        } catch (final JsonProcessingException ex) {
            throw new IllegalArgumentException("Cannot render as JSON: " + ex.getMessage(), ex);
        }
    }

    /**
     * Writes a graph to the stream supplied using the RDF format specified.
     * 
     * @param model
     *            the graph to write
     * @param format
     *            the RDF format
     * @param stream
     *            the stream to write to, not closed by this method
     * @throws IOException
     *             on failure
     */
    public static void write(final Model model, final RDFFormat format, final OutputStream stream)
            throws IOException {
        final RDFWriter writer = Rio.createWriter(format, stream);
        try {
            writer.startRDF();
            for (final Map.Entry<String, String> entry : COMMON_NAMESPACES.entrySet()) {
                writer.handleNamespace(entry.getKey(), entry.getValue());
            }
            for (final Statement statement : model) {
                writer.handleStatement(statement);
            }
            writer.endRDF();
        } catch (final RDFHandlerException ex) {
            throw new IOException("Cannot write graph as " + format.getName(), ex);
        }
    }

    /**
     * Returns the Turtle rendering of a graph.
     * 
     * @param model
     *            the graph to render
     * @return the Turtle string
     */
    public static String toString(final Model model) {
        final ByteArrayOutputStream stream = new ByteArrayOutputStream();
        try {
            write(model, RDFFormat.TURTLE, stream);
        } catch (final IOException ex) {
            throw new IllegalStateException("Cannot render graph: " + ex.getMessage(), ex);
        }
        return new String(stream.toByteArray(), Charsets.UTF_8);
    }

}
