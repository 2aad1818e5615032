package nl.uu.edpop.explorer.reader.sparql;

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;
import com.google.common.collect.Range;

import org.openrdf.OpenRDFException;
import org.openrdf.model.Model;
import org.openrdf.model.Value;
import org.openrdf.query.BindingSet;
import org.openrdf.query.GraphQueryResult;
import org.openrdf.query.MalformedQueryException;
import org.openrdf.query.QueryEvaluationException;
import org.openrdf.query.QueryLanguage;
import org.openrdf.query.TupleQueryResult;
import org.openrdf.repository.Repository;
import org.openrdf.repository.RepositoryConnection;
import org.openrdf.repository.RepositoryException;
import org.openrdf.repository.sparql.SPARQLRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nl.uu.edpop.explorer.Catalog;
import nl.uu.edpop.explorer.Reader;
import nl.uu.edpop.explorer.ReaderException;
import nl.uu.edpop.explorer.data.BibliographicalRecord;
import nl.uu.edpop.explorer.data.BiographicalRecord;
import nl.uu.edpop.explorer.data.Data;
import nl.uu.edpop.explorer.data.Field;
import nl.uu.edpop.explorer.data.Record;

/**
 * Base class of readers of catalogs exposing a SPARQL endpoint.
 * <p>
 * A search selects the subjects having a {@code schema:name} and at least one value matching
 * the search term (case-insensitive regular expression), restricted by the optional
 * {@link #getFilter() filter}. All the matching subjects are retrieved at once and turned into
 * lazy records, whose data is obtained with a {@code CONSTRUCT} query on first access and
 * handed to {@link #populate(Record, String, Model)}. Record identifiers are derived from the
 * subject IRIs, so the catalog must declare an IRI prefix.
 * </p>
 */
public abstract class SparqlReader extends Reader<String> {

    private static final Logger LOGGER = LoggerFactory.getLogger(SparqlReader.class);

    private static final String SELECT_TEMPLATE = "PREFIX schema: <http://schema.org/>\n"
            + "SELECT ?s ?name\nWHERE {\n  ?s ?p ?o .\n  ?s schema:name ?name .\n%s"
            + "  FILTER (regex(str(?o), \"%s\", \"i\"))\n}\nORDER BY ?s";

    private static final String CONSTRUCT_TEMPLATE = "CONSTRUCT { <%1$s> ?p ?o }\n"
            + "WHERE { <%1$s> ?p ?o }";

    private final String endpoint;

    @Nullable
    private Repository repository;

    protected SparqlReader(final Catalog catalog, final String endpoint) {
        super(catalog);
        Preconditions.checkArgument(catalog.getIRIPrefix() != null,
                "Catalog %s has no IRI prefix", catalog);
        this.endpoint = Preconditions.checkNotNull(endpoint);
    }

    public final String getEndpoint() {
        return this.endpoint;
    }

    /**
     * Replaces the repository queried by this reader, by default a {@link SPARQLRepository}
     * for the endpoint URL.
     * 
     * @param repository
     *            an initialized repository
     */
    public final synchronized void setRepository(final Repository repository) {
        this.repository = Preconditions.checkNotNull(repository);
    }

    protected final synchronized Repository getRepository() throws ReaderException {
        if (this.repository == null) {
            final SPARQLRepository repository = new SPARQLRepository(this.endpoint);
            try {
                repository.initialize();
            } catch (final RepositoryException ex) {
                throw new ReaderException("Could not connect to SPARQL endpoint "
                        + this.endpoint, ex);
            }
            this.repository = repository;
        }
        return this.repository;
    }

    /**
     * Returns additional graph patterns restricting the subjects returned by a search, such as
     * {@code ?s a schema:Person .}. Empty by default.
     * 
     * @return the graph patterns
     */
    protected String getFilter() {
        return "";
    }

    @Override
    public String transformQuery(final String query) {
        final String filter = getFilter();
        return String.format(SELECT_TEMPLATE, filter.isEmpty() ? "" : "  " + filter + "\n",
                escape(query));
    }

    @Override
    public Range<Integer> fetchRange(final Range<Integer> range) throws ReaderException {
        final Integer total = getNumberOfResults();
        if (total != null) {
            return truncate(range, total);
        }
        final String query = getPreparedQuery();
        if (query == null) {
            throw new ReaderException("First set a query on " + this);
        }
        final Map<String, String> subjects = select(query);
        int index = 0;
        for (final Map.Entry<String, String> entry : subjects.entrySet()) {
            putRecord(index++, createRecord(entry.getKey(), entry.getValue()));
        }
        setNumberOfResults(index);
        LOGGER.debug("{}: {} subjects selected from {}", this, index, this.endpoint);
        return Range.closedOpen(0, index);
    }

    @Override
    public Record getByID(final String identifier) throws ReaderException {
        final String iri = getCatalog().identifierToIRI(identifier).stringValue();
        return createRecord(iri, null);
    }

    /**
     * Creates an empty lazy record for a subject IRI. By default a
     * {@link SparqlBibliographicalRecord} or a {@link SparqlBiographicalRecord} is returned,
     * based on the catalog type.
     * 
     * @param iri
     *            the subject IRI
     * @return the record
     */
    protected Record newLazyRecord(final String iri) {
        switch (getCatalog().getType()) {
        case BIBLIOGRAPHICAL:
            return new SparqlBibliographicalRecord(this, iri);
        case BIOGRAPHICAL:
            return new SparqlBiographicalRecord(this, iri);
        default:
            throw new IllegalStateException("No lazy record class for catalog type "
                    + getCatalog().getType() + ": override newLazyRecord()");
        }
    }

    /**
     * Fills a lazy record with the data retrieved for its subject.
     * 
     * @param record
     *            the record, as created by {@link #newLazyRecord(String)}
     * @param iri
     *            the subject IRI
     * @param model
     *            the statements having the subject IRI as subject
     * @throws ReaderException
     *             if the data cannot be converted
     */
    protected abstract void populate(Record record, String iri, Model model)
            throws ReaderException;

    private Record createRecord(final String iri, @Nullable final String name)
            throws ReaderException {
        final Record record = newLazyRecord(iri);
        record.setIdentifier(getCatalog().iriToIdentifier(iri));
        record.setLink(iri);
        if (name != null) {
            if (record instanceof BiographicalRecord) {
                ((BiographicalRecord) record).setName(new Field(name));
            } else if (record instanceof BibliographicalRecord) {
                ((BibliographicalRecord) record).setTitle(new Field(name));
            }
        }
        return record;
    }

    final void load(final Record record, final String iri) throws ReaderException {
        if (iri.indexOf('>') >= 0 || iri.indexOf(' ') >= 0) {
            throw new ReaderException("Invalid IRI " + iri);
        }
        final Model model = construct(String.format(CONSTRUCT_TEMPLATE, iri));
        if (model.isEmpty()) {
            throw new ReaderException("No data available for " + iri);
        }
        populate(record, iri, model);
    }

    /**
     * Evaluates a SELECT query binding {@code ?s} and {@code ?name}.
     * 
     * @param query
     *            the query
     * @return a map from subject IRIs to names, in query result order
     * @throws ReaderException
     *             if the query is malformed or the endpoint fails
     */
    protected Map<String, String> select(final String query) throws ReaderException {
        final Map<String, String> subjects = Maps.newLinkedHashMap();
        RepositoryConnection connection = null;
        TupleQueryResult result = null;
        try {
            connection = getRepository().getConnection();
            result = connection.prepareTupleQuery(QueryLanguage.SPARQL, query).evaluate();
            while (result.hasNext()) {
                final BindingSet bindings = result.next();
                final Value subject = bindings.getValue("s");
                final Value name = bindings.getValue("name");
                if (subject != null && !subjects.containsKey(subject.stringValue())) {
                    subjects.put(subject.stringValue(), name == null ? null : name
                            .stringValue());
                }
            }
        } catch (final MalformedQueryException ex) {
            throw new ReaderException("Malformed SPARQL query: " + ex.getMessage(), ex);
        } catch (final OpenRDFException ex) {
            LOGGER.warn("SPARQL query failed on {}: {}", this.endpoint, ex.getMessage());
            throw new ReaderException("Could not query " + this.endpoint + ": "
                    + ex.getMessage(), ex);
        } finally {
            close(result, connection);
        }
        return subjects;
    }

    /**
     * Evaluates a CONSTRUCT query.
     * 
     * @param query
     *            the query
     * @return the statements returned
     * @throws ReaderException
     *             if the query is malformed or the endpoint fails
     */
    protected Model construct(final String query) throws ReaderException {
        final Model model = Data.newModel();
        RepositoryConnection connection = null;
        GraphQueryResult result = null;
        try {
            connection = getRepository().getConnection();
            result = connection.prepareGraphQuery(QueryLanguage.SPARQL, query).evaluate();
            while (result.hasNext()) {
                model.add(result.next());
            }
        } catch (final MalformedQueryException ex) {
            throw new ReaderException("Malformed SPARQL query: " + ex.getMessage(), ex);
        } catch (final OpenRDFException ex) {
            LOGGER.warn("SPARQL query failed on {}: {}", this.endpoint, ex.getMessage());
            throw new ReaderException("Could not query " + this.endpoint + ": "
                    + ex.getMessage(), ex);
        } finally {
            close(result, connection);
        }
        return model;
    }

    private static void close(@Nullable final Object result,
            @Nullable final RepositoryConnection connection) {
        try {
            if (result instanceof TupleQueryResult) {
                ((TupleQueryResult) result).close();
            } else if (result instanceof GraphQueryResult) {
                ((GraphQueryResult) result).close();
            }
        } catch (final QueryEvaluationException ex) {
            LOGGER.error("Error closing SPARQL query result", ex);
        }
        if (connection != null) {
            try {
                connection.close();
            } catch (final RepositoryException ex) {
                LOGGER.error("Error closing repository connection", ex);
            }
        }
    }

    private static String escape(final String string) {
        final StringBuilder builder = new StringBuilder();
        for (int i = 0; i < string.length(); ++i) {
            final char c = string.charAt(i);
            if (c == '\\' || c == '"') {
                builder.append('\\');
            } else if (c == '\n') {
                builder.append("\\n");
                continue;
            } else if (c == '\r') {
                builder.append("\\r");
                continue;
            }
            builder.append(c);
        }
        return builder.toString();
    }

}
