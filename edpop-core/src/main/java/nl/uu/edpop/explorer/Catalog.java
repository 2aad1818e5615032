package nl.uu.edpop.explorer;

import java.io.Serializable;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import org.openrdf.model.Model;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.vocabulary.RDF;

import nl.uu.edpop.explorer.data.Data;
import nl.uu.edpop.explorer.internal.Settings;
import nl.uu.edpop.explorer.vocabulary.SDO;

/**
 * Static description of a catalog, shared by all the {@link Reader} instances querying it.
 * <p>
 * A {@code Catalog} is declared as a constant by every reader class, so that catalog metadata
 * (its URI, the kind of records it returns, how record IRIs are minted) can be accessed without
 * instantiating the reader. Instances are immutable and are created with {@link #builder(URI)}.
 * </p>
 */
public final class Catalog implements Serializable {

    private static final long serialVersionUID = 1L;

    private final URI uri;

    private final ReaderType type;

    @Nullable
    private final String iriPrefix;

    @Nullable
    private final String shortName;

    @Nullable
    private final String description;

    private final boolean fetchAllAtOnce;

    @Nullable
    private final Integer defaultRecordsPerPage;

    private Catalog(final Builder builder) {
        this.uri = builder.uri;
        this.type = MoreObjects.firstNonNull(builder.type, ReaderType.GENERIC);
        this.iriPrefix = builder.iriPrefix;
        this.shortName = builder.shortName;
        this.description = builder.description;
        this.fetchAllAtOnce = builder.fetchAllAtOnce;
        this.defaultRecordsPerPage = builder.defaultRecordsPerPage;
    }

    public static Builder builder(final URI uri) {
        return new Builder(uri);
    }

    public URI getURI() {
        return this.uri;
    }

    public ReaderType getType() {
        return this.type;
    }

    @Nullable
    public String getIRIPrefix() {
        return this.iriPrefix;
    }

    /**
     * Returns the short, human readable catalog name.
     * 
     * @return the short name, defaulting to the slug
     */
    public String getShortName() {
        return this.shortName != null ? this.shortName : getSlug();
    }

    @Nullable
    public String getDescription() {
        return this.description;
    }

    /**
     * Returns whether readers of this catalog retrieve all results with the first fetch.
     * 
     * @return true if all results are fetched at once
     */
    public boolean isFetchAllAtOnce() {
        return this.fetchAllAtOnce;
    }

    /**
     * Returns the number of records fetched by {@link Reader#fetch()} when no number is given.
     * 
     * @return the catalog-specific page size, or the configured default
     */
    public int getDefaultRecordsPerPage() {
        return this.defaultRecordsPerPage != null ? this.defaultRecordsPerPage : Settings
                .getDefault().getRecordsPerPage();
    }

    /**
     * Returns the last path segment of the catalog URI, used as catalog identifier.
     * 
     * @return the slug
     */
    public String getSlug() {
        String string = this.uri.stringValue();
        while (string.endsWith("/")) {
            string = string.substring(0, string.length() - 1);
        }
        return string.substring(Math.max(string.lastIndexOf('/'), string.lastIndexOf('#')) + 1);
    }

    /**
     * Converts a catalog-local record identifier to an IRI by percent-encoding it and prepending
     * the IRI prefix.
     * 
     * @param identifier
     *            the identifier
     * @return the record IRI
     * @throws ReaderException
     *             if the catalog has no IRI prefix
     */
    public URI identifierToIRI(final String identifier) throws ReaderException {
        Preconditions.checkNotNull(identifier);
        if (this.iriPrefix == null) {
            throw new ReaderException("Catalog " + getShortName() + " has no IRI prefix");
        }
        return Data.getValueFactory().createURI(
                this.iriPrefix + Data.encodeIRIComponent(identifier));
    }

    /**
     * Converts a record IRI back to the catalog-local identifier.
     * 
     * @param iri
     *            the record IRI
     * @return the identifier
     * @throws ReaderException
     *             if the catalog has no IRI prefix or the IRI does not start with it
     */
    public String iriToIdentifier(final String iri) throws ReaderException {
        Preconditions.checkNotNull(iri);
        if (this.iriPrefix == null) {
            throw new ReaderException("Catalog " + getShortName() + " has no IRI prefix");
        }
        if (!iri.startsWith(this.iriPrefix)) {
            throw new ReaderException("IRI " + iri + " does not start with " + this.iriPrefix);
        }
        try {
            return Data.decodeIRIComponent(iri.substring(this.iriPrefix.length()));
        } catch (final IllegalArgumentException ex) {
            throw new ReaderException("Invalid IRI " + iri + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Returns an RDF description of the catalog.
     * 
     * @return a graph with the catalog type, name, description and slug
     */
    public Model toGraph() {
        final ValueFactory factory = Data.getValueFactory();
        final Model model = Data.newModel();
        model.add(this.uri, RDF.TYPE, this.type.getCatalogClass());
        model.add(this.uri, SDO.NAME, factory.createLiteral(getShortName()));
        if (this.description != null) {
            model.add(this.uri, SDO.DESCRIPTION, factory.createLiteral(this.description));
        }
        model.add(this.uri, SDO.IDENTIFIER, factory.createLiteral(getSlug()));
        return model;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Catalog)) {
            return false;
        }
        return this.uri.equals(((Catalog) object).uri);
    }

    @Override
    public int hashCode() {
        return this.uri.hashCode();
    }

    @Override
    public String toString() {
        return getShortName();
    }

    public static final class Builder {

        private final URI uri;

        @Nullable
        private ReaderType type;

        @Nullable
        private String iriPrefix;

        @Nullable
        private String shortName;

        @Nullable
        private String description;

        private boolean fetchAllAtOnce;

        @Nullable
        private Integer defaultRecordsPerPage;

        Builder(final URI uri) {
            this.uri = Preconditions.checkNotNull(uri);
        }

        public Builder type(@Nullable final ReaderType type) {
            this.type = type;
            return this;
        }

        public Builder iriPrefix(@Nullable final String iriPrefix) {
            this.iriPrefix = iriPrefix;
            return this;
        }

        public Builder shortName(@Nullable final String shortName) {
            this.shortName = shortName;
            return this;
        }

        public Builder description(@Nullable final String description) {
            this.description = description;
            return this;
        }

        public Builder fetchAllAtOnce(final boolean fetchAllAtOnce) {
            this.fetchAllAtOnce = fetchAllAtOnce;
            return this;
        }

        public Builder defaultRecordsPerPage(@Nullable final Integer defaultRecordsPerPage) {
            Preconditions.checkArgument(defaultRecordsPerPage == null
                    || defaultRecordsPerPage > 0);
            this.defaultRecordsPerPage = defaultRecordsPerPage;
            return this;
        }

        public Catalog build() {
            return new Catalog(this);
        }

    }

}
