package nl.uu.edpop.explorer.data;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.openrdf.model.BNode;
import org.openrdf.model.Model;
import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.RDF;

import nl.uu.edpop.explorer.vocabulary.EDPOPREC;

/**
 * A normalized, typed datum extracted from a catalog record.
 * <p>
 * A field always has an original text, the literal string found in the source. Additional
 * values are stored in <i>subfields</i>, declared by the field class together with the RDF
 * predicate and the {@link Datatype} used to serialize them. The base class declares
 * {@code original_text}, {@code summary_text}, {@code unknown}, {@code authority_record} and
 * {@code normalized_text}; subclasses declare further subfields with
 * {@link #addSubfield(String, URI, String)} in their constructor.
 * </p>
 * <p>
 * The subject of a field is an anonymous node until the field is serialized as part of a record
 * having an IRI, in which case it becomes an IRI derived from the record IRI, the record
 * attribute holding the field and a hash of the field content.
 * </p>
 */
public class Field {

    public static final String ORIGINAL_TEXT = "original_text";

    public static final String SUMMARY_TEXT = "summary_text";

    public static final String UNKNOWN = "unknown";

    public static final String AUTHORITY_RECORD = "authority_record";

    public static final String NORMALIZED_TEXT = "normalized_text";

    private final URI type;

    private final List<Subfield> subfields;

    private final Map<String, Object> values;

    private final BNode node;

    @Nullable
    private URI recordIRI;

    @Nullable
    private String attribute;

    /**
     * Creates a generic field with the original text specified.
     * 
     * @param originalText
     *            the text found in the source
     * @throws FieldException
     *             if the text is null
     */
    public Field(final String originalText) throws FieldException {
        this(EDPOPREC.FIELD, originalText);
    }

    protected Field(final URI type, final String originalText) throws FieldException {
        if (originalText == null) {
            throw new FieldException("Field original text must be a string, got null");
        }
        this.type = Preconditions.checkNotNull(type);
        this.subfields = Lists.newArrayList();
        this.values = Maps.newHashMap();
        this.node = Data.getValueFactory().createBNode();
        addSubfield(ORIGINAL_TEXT, EDPOPREC.ORIGINAL_TEXT, Datatype.STRING);
        addSubfield(SUMMARY_TEXT, EDPOPREC.SUMMARY_TEXT, Datatype.STRING);
        addSubfield(UNKNOWN, EDPOPREC.UNKNOWN, Datatype.BOOLEAN);
        addSubfield(AUTHORITY_RECORD, EDPOPREC.AUTHORITY_RECORD, Datatype.URIREF);
        addSubfield(NORMALIZED_TEXT, EDPOPREC.NORMALIZED_TEXT, Datatype.STRING);
        this.values.put(ORIGINAL_TEXT, originalText);
    }

    /**
     * Declares a subfield. The datatype is resolved only at serialization time.
     * 
     * @param name
     *            the subfield name, unique within the field
     * @param predicate
     *            the predicate linking the field to the subfield value
     * @param datatype
     *            the name of the subfield {@link Datatype}
     */
    protected final void addSubfield(final String name, final URI predicate,
            final String datatype) {
        Preconditions.checkNotNull(name);
        for (final Subfield subfield : this.subfields) {
            Preconditions.checkArgument(!subfield.name.equals(name), "Duplicate subfield %s",
                    name);
        }
        this.subfields.add(new Subfield(name, Preconditions.checkNotNull(predicate),
                Preconditions.checkNotNull(datatype)));
    }

    public final URI getType() {
        return this.type;
    }

    public final List<String> getSubfieldNames() {
        final List<String> names = Lists.newArrayListWithCapacity(this.subfields.size());
        for (final Subfield subfield : this.subfields) {
            names.add(subfield.name);
        }
        return Collections.unmodifiableList(names);
    }

    /**
     * Returns the value of a subfield. The {@code summary_text} value is computed by
     * {@link #getSummaryText()}.
     * 
     * @param name
     *            the subfield name
     * @return the value, or null if not set
     */
    @Nullable
    public final Object get(final String name) {
        checkSubfield(name);
        if (SUMMARY_TEXT.equals(name)) {
            return getSummaryText();
        }
        final Object value = this.values.get(name);
        if (value == null && NORMALIZED_TEXT.equals(name)) {
            return createNormalizedText();
        }
        return value;
    }

    /**
     * Sets the value of a subfield. The value type is not checked here: a value not matching the
     * subfield datatype is reported by {@link #toGraph()}.
     * 
     * @param name
     *            the name of a declared subfield other than {@code summary_text}
     * @param value
     *            the value, null to clear it
     */
    public final void set(final String name, @Nullable final Object value) {
        checkSubfield(name);
        Preconditions.checkArgument(!SUMMARY_TEXT.equals(name), "Subfield %s is computed",
                name);
        Preconditions.checkArgument(!ORIGINAL_TEXT.equals(name) || value != null,
                "Original text cannot be cleared");
        if (value == null) {
            this.values.remove(name);
        } else {
            this.values.put(name, value);
        }
    }

    private void checkSubfield(final String name) {
        for (final Subfield subfield : this.subfields) {
            if (subfield.name.equals(name)) {
                return;
            }
        }
        throw new IllegalArgumentException("Unknown subfield " + name + " for "
                + getClass().getSimpleName());
    }

    public final String getOriginalText() {
        return this.values.get(ORIGINAL_TEXT).toString();
    }

    @Nullable
    public final Boolean getUnknown() {
        return (Boolean) this.values.get(UNKNOWN);
    }

    public final void setUnknown(@Nullable final Boolean unknown) {
        set(UNKNOWN, unknown);
    }

    @Nullable
    public final URI getAuthorityRecord() {
        return (URI) this.values.get(AUTHORITY_RECORD);
    }

    public final void setAuthorityRecord(@Nullable final URI authorityRecord) {
        set(AUTHORITY_RECORD, authorityRecord);
    }

    /**
     * Returns the normalized text: the value set with {@link #setNormalizedText(String)} if any,
     * otherwise the value computed by {@link #createNormalizedText()}.
     * 
     * @return the normalized text, or null
     */
    @Nullable
    public final String getNormalizedText() {
        final Object value = get(NORMALIZED_TEXT);
        return value == null ? null : value.toString();
    }

    public final void setNormalizedText(@Nullable final String normalizedText) {
        set(NORMALIZED_TEXT, normalizedText);
    }

    @Nullable
    protected String createNormalizedText() {
        return null;
    }

    /**
     * Returns a human-readable summary derived from the other subfields. The base implementation
     * has none.
     * 
     * @return the summary, or null if the field class defines no summary or it cannot be computed
     */
    @Nullable
    public String getSummaryText() {
        return null;
    }

    /**
     * Derives subfield values from the original text. The base implementation does nothing.
     * 
     * @return the outcome of the normalization
     */
    public NormalizationResult normalize() {
        return NormalizationResult.NO_DATA;
    }

    void bind(final URI recordIRI, final String attribute) {
        this.recordIRI = Preconditions.checkNotNull(recordIRI);
        this.attribute = Preconditions.checkNotNull(attribute);
    }

    /**
     * Returns the subject of the field.
     * 
     * @return the field IRI if the field belongs to a record having an IRI, otherwise an
     *         anonymous node that does not change during the lifetime of the field
     */
    public final Resource getSubject() {
        if (this.recordIRI == null) {
            return this.node;
        }
        final List<Object> content = Lists.newArrayList();
        content.add(getClass().getName());
        for (final Subfield subfield : this.subfields) {
            final Object value = get(subfield.name);
            if (value != null) {
                content.add(subfield.name);
                content.add(value.toString());
            }
        }
        return Data.getValueFactory().createURI(
                this.recordIRI.stringValue() + "/" + Data.encodeIRIComponent(this.attribute)
                        + "/" + Data.hash(content.toArray()));
    }

    /**
     * Returns the RDF description of the field: its type and one triple for each subfield having
     * a value.
     * 
     * @return the RDF graph
     * @throws FieldException
     *             at the first subfield whose datatype is unknown or whose value does not match
     *             its datatype; no graph is returned in that case
     */
    public final Model toGraph() throws FieldException {
        final Model model = Data.newModel();
        final Resource subject = getSubject();
        model.add(subject, RDF.TYPE, this.type);
        for (final Subfield subfield : this.subfields) {
            final Object value = get(subfield.name);
            if (value == null) {
                continue;
            }
            final Datatype datatype = Datatype.forName(subfield.datatype);
            if (datatype == null) {
                throw new FieldException("Subfield " + subfield.name + " of "
                        + getClass().getSimpleName() + " has unknown datatype "
                        + subfield.datatype);
            }
            if (!datatype.accepts(value)) {
                throw new FieldException("Subfield " + subfield.name + " of "
                        + getClass().getSimpleName() + " should be of type "
                        + datatype.getInputType().getSimpleName() + " but is "
                        + value.getClass().getSimpleName());
            }
            final Value object = datatype.convert(value);
            model.add(subject, subfield.predicate, object);
        }
        return model;
    }

    @Override
    public String toString() {
        final String summary = getSummaryText();
        return summary != null ? summary : getOriginalText();
    }

    private static final class Subfield {

        final String name;

        final URI predicate;

        final String datatype;

        Subfield(final String name, final URI predicate, final String datatype) {
            this.name = name;
            this.predicate = predicate;
            this.datatype = datatype;
        }

    }

}
