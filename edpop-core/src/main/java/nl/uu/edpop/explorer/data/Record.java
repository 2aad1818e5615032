package nl.uu.edpop.explorer.data;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.openrdf.model.BNode;
import org.openrdf.model.Model;
import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.vocabulary.RDF;

import nl.uu.edpop.explorer.Catalog;
import nl.uu.edpop.explorer.ReaderException;
import nl.uu.edpop.explorer.vocabulary.EDPOPREC;

/**
 * A normalized catalog item.
 * <p>
 * A record has an identity (the catalog it comes from, an optional catalog-local identifier, an
 * optional public URL and the optional raw data returned by the catalog) and a set of
 * <i>attributes</i> holding {@link Field}s. Attributes are declared by record classes with
 * {@link #addField(String, URI, Class)}, which associates each attribute with the predicate
 * linking the record to the field and with the expected field class. An attribute holds either
 * nothing, a single field or a list of fields.
 * </p>
 * <p>
 * The subject of a record is the IRI minted by the catalog from the identifier, if both are
 * available, otherwise an anonymous node that does not change during the lifetime of the record.
 * </p>
 */
public class Record {

    private final Catalog catalog;

    private final List<FieldDefinition> definitions;

    private final Map<String, Object> values;

    private final BNode node;

    @Nullable
    private String identifier;

    @Nullable
    private String link;

    @Nullable
    private Object data;

    @Nullable
    private URI iri;

    public Record(final Catalog catalog) {
        this.catalog = Preconditions.checkNotNull(catalog);
        this.definitions = Lists.newArrayList();
        this.values = Maps.newHashMap();
        this.node = Data.getValueFactory().createBNode();
    }

    /**
     * Declares an attribute.
     * 
     * @param name
     *            the attribute name, unique within the record
     * @param predicate
     *            the predicate linking the record to the fields of the attribute
     * @param fieldClass
     *            the class every field of the attribute must be an instance of
     * @throws RecordException
     *             if the name is already declared or the class is not a field class
     */
    protected final void addField(final String name, final URI predicate,
            final Class<? extends Field> fieldClass) throws RecordException {
        Preconditions.checkNotNull(name);
        Preconditions.checkNotNull(predicate);
        if (fieldClass == null || !Field.class.isAssignableFrom(fieldClass)) {
            throw new RecordException("Attribute " + name + " of " + getClass().getSimpleName()
                    + " is not declared with a field class: " + fieldClass);
        }
        if (findDefinition(name) != null) {
            throw new RecordException("Duplicate attribute " + name + " in "
                    + getClass().getSimpleName());
        }
        this.definitions.add(new FieldDefinition(name, predicate, fieldClass));
    }

    public final List<String> getFieldNames() {
        final List<String> names = Lists.newArrayListWithCapacity(this.definitions.size());
        for (final FieldDefinition definition : this.definitions) {
            names.add(definition.name);
        }
        return Collections.unmodifiableList(names);
    }

    /**
     * Returns the value of an attribute, fetching the record first if it is lazy.
     * 
     * @param name
     *            the attribute name
     * @return a {@link Field}, a list of fields, or null
     */
    @Nullable
    public final Object get(final String name) {
        fetch();
        return peek(name);
    }

    /**
     * Returns the value of an attribute without fetching the record.
     * 
     * @param name
     *            the attribute name
     * @return a {@link Field}, a list of fields, or null
     */
    @Nullable
    protected final Object peek(final String name) {
        checkDefinition(name);
        return this.values.get(name);
    }

    /**
     * Sets the value of an attribute. Values are checked against the declared field class by
     * {@link #toGraph()}.
     * 
     * @param name
     *            the attribute name
     * @param value
     *            a {@link Field}, a list of fields, or null to clear the attribute
     */
    public final void set(final String name, @Nullable final Object value) {
        checkDefinition(name);
        if (value == null) {
            this.values.remove(name);
        } else {
            this.values.put(name, value);
        }
    }

    @Nullable
    protected final <T extends Field> T getField(final String name, final Class<T> fieldClass) {
        final Object value = get(name);
        return fieldClass.isInstance(value) ? fieldClass.cast(value) : null;
    }

    protected final <T extends Field> List<T> getFieldList(final String name,
            final Class<T> fieldClass) {
        final Object value = get(name);
        final List<T> result = Lists.newArrayList();
        if (value instanceof Iterable<?>) {
            for (final Object element : (Iterable<?>) value) {
                if (fieldClass.isInstance(element)) {
                    result.add(fieldClass.cast(element));
                }
            }
        } else if (fieldClass.isInstance(value)) {
            result.add(fieldClass.cast(value));
        }
        return result;
    }

    protected final void setFieldList(final String name,
            @Nullable final List<? extends Field> fields) {
        set(name, fields == null || fields.isEmpty() ? null : Lists.newArrayList(fields));
    }

    @Nullable
    private FieldDefinition findDefinition(final String name) {
        for (final FieldDefinition definition : this.definitions) {
            if (definition.name.equals(name)) {
                return definition;
            }
        }
        return null;
    }

    private void checkDefinition(final String name) {
        Preconditions.checkArgument(findDefinition(name) != null, "Unknown attribute %s for %s",
                name, getClass().getSimpleName());
    }

    public final Catalog getCatalog() {
        return this.catalog;
    }

    @Nullable
    public final String getIdentifier() {
        return this.identifier;
    }

    public final void setIdentifier(@Nullable final String identifier) {
        this.identifier = identifier;
        this.iri = null;
    }

    /**
     * Returns the URL where a user can view the record in the catalog.
     * 
     * @return the link, if any
     */
    @Nullable
    public final String getLink() {
        return this.link;
    }

    public final void setLink(@Nullable final String link) {
        this.link = link;
    }

    /**
     * Returns the raw data as set by the reader, without fetching the record.
     * 
     * @return a {@link RawData} or a map, or null
     */
    @Nullable
    public final Object getData() {
        return this.data;
    }

    /**
     * Sets the raw data returned by the catalog.
     * 
     * @param data
     *            a {@link RawData} object, a map with string keys, or null
     */
    public final void setData(@Nullable final Object data) {
        Preconditions.checkArgument(data == null || data instanceof RawData
                || data instanceof Map<?, ?>, "Unsupported raw data %s", data);
        this.data = data;
    }

    /**
     * Returns the raw data as a map, fetching the record first if it is lazy.
     * 
     * @return the raw data map, or null if the record has no raw data
     */
    @SuppressWarnings("unchecked")
    @Nullable
    public final Map<String, Object> getDataMap() {
        fetch();
        if (this.data instanceof RawData) {
            return ((RawData) this.data).toMap();
        }
        return (Map<String, Object>) this.data;
    }

    /**
     * Returns the record IRI.
     * 
     * @return the IRI, or null if the record has no identifier or the catalog has no IRI prefix
     */
    @Nullable
    public final URI getIRI() {
        if (this.iri == null && this.identifier != null
                && this.catalog.getIRIPrefix() != null) {
            try {
                this.iri = this.catalog.identifierToIRI(this.identifier);
            } catch (final ReaderException ex) {
                throw new RecordException("Cannot mint IRI for record " + this.identifier, ex);
            }
        }
        return this.iri;
    }

    /**
     * Returns the subject of the record: its IRI if available, otherwise an anonymous node.
     * Repeated invocations return the same value as long as the identifier does not change.
     * 
     * @return the subject
     */
    public final Resource getSubject() {
        final URI iri = getIRI();
        return iri != null ? iri : this.node;
    }

    /**
     * Performs the deferred retrieval of a lazy record. Non-lazy records do nothing.
     * 
     * @throws RecordException
     *             if the retrieval fails
     */
    public void fetch() throws RecordException {
    }

    /**
     * Returns the RDF description of the record and of all its fields, fetching the record first
     * if it is lazy.
     * 
     * @return the RDF graph
     * @throws RecordException
     *             if an attribute holds a value that is not an instance of its field class
     * @throws FieldException
     *             if a field cannot be serialized
     */
    public final Model toGraph() throws RecordException, FieldException {
        fetch();
        final ValueFactory factory = Data.getValueFactory();
        final Model model = Data.newModel();
        final Resource subject = getSubject();
        final URI subjectIRI = getIRI();
        model.add(subject, RDF.TYPE, this.catalog.getType().getRecordClass());
        model.add(subject, EDPOPREC.FROM_CATALOG, this.catalog.getURI());
        if (this.identifier != null) {
            model.add(subject, EDPOPREC.IDENTIFIER, factory.createLiteral(this.identifier));
        }
        if (this.link != null) {
            model.add(subject, EDPOPREC.PUBLIC_URL, factory.createLiteral(this.link));
        }
        if (this.data != null) {
            final Object rawData = this.data instanceof RawData ? ((RawData) this.data).toMap()
                    : this.data;
            final String json;
            try {
                json = Data.toJSON(rawData);
            } catch (final IllegalArgumentException ex) {
                throw new RecordException("Cannot serialize raw data of record "
                        + this.identifier, ex);
            }
            model.add(subject, EDPOPREC.ORIGINAL_DATA, factory.createLiteral(json));
        }
        for (final FieldDefinition definition : this.definitions) {
            final Object value = this.values.get(definition.name);
            if (value == null) {
                continue;
            }
            final Iterable<?> fields = value instanceof Iterable<?> ? (Iterable<?>) value
                    : Collections.singletonList(value);
            for (final Object field : fields) {
                if (field == null) {
                    continue;
                }
                if (!definition.fieldClass.isInstance(field)) {
                    throw new RecordException("Attribute " + definition.name + " of "
                            + getClass().getSimpleName() + " should hold "
                            + definition.fieldClass.getSimpleName() + " instances, got "
                            + field.getClass().getSimpleName());
                }
                final Field f = (Field) field;
                if (subjectIRI != null) {
                    f.bind(subjectIRI, definition.name);
                }
                model.add(subject, definition.predicate, f.getSubject());
                model.addAll(f.toGraph());
            }
        }
        return model;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + " "
                + MoreObjects.firstNonNull(this.identifier, "(no identifier)");
    }

    private static final class FieldDefinition {

        final String name;

        final URI predicate;

        final Class<? extends Field> fieldClass;

        FieldDefinition(final String name, final URI predicate,
                final Class<? extends Field> fieldClass) {
            this.name = name;
            this.predicate = predicate;
            this.fieldClass = fieldClass;
        }

    }

}
