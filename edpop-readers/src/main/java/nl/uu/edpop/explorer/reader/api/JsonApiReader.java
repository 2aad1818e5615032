package nl.uu.edpop.explorer.reader.api;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.Charset;

import javax.annotation.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.collect.Range;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nl.uu.edpop.explorer.Catalog;
import nl.uu.edpop.explorer.GetByIdBasedOnQuery;
import nl.uu.edpop.explorer.NotFoundException;
import nl.uu.edpop.explorer.QueryBasedLookup;
import nl.uu.edpop.explorer.Reader;
import nl.uu.edpop.explorer.ReaderException;
import nl.uu.edpop.explorer.data.Record;
import nl.uu.edpop.explorer.reader.http.HttpTransport;

/**
 * Base class of readers of catalogs offering a search API returning JSON.
 * <p>
 * Subclasses build the URI of a result page ({@link #buildPageURI(String, int, int)}) and
 * extract the total number of results, the result items and the records from the parsed JSON
 * response. Single records are retrieved from the URI returned by
 * {@link #buildRecordURI(String)}, or with a search query if the API has no record endpoint.
 * </p>
 */
public abstract class JsonApiReader extends Reader<String> implements QueryBasedLookup<String> {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonApiReader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String ACCEPT = "application/json";

    private HttpTransport transport;

    protected JsonApiReader(final Catalog catalog) {
        super(catalog);
        this.transport = HttpTransport.getDefault();
    }

    public final void setTransport(final HttpTransport transport) {
        this.transport = Preconditions.checkNotNull(transport);
    }

    @Override
    public String transformQuery(final String query) {
        return query;
    }

    @Override
    public String prepareGetByIDQuery(final String identifier) {
        return transformQuery(identifier);
    }

    @Override
    public Range<Integer> fetchRange(final Range<Integer> range) throws ReaderException {
        final String query = getPreparedQuery();
        if (query == null) {
            throw new ReaderException("First set a query on " + this);
        }
        final int start = range.lowerEndpoint();
        final int count = range.upperEndpoint() - start;
        final Integer total = getNumberOfResults();
        if (count <= 0 || total != null && start >= total) {
            return Range.closedOpen(start, start);
        }
        final URI uri = buildPageURI(query, start, count);
        final JsonNode response = getJson(uri);
        setNumberOfResults(getTotal(response));
        int index = start;
        for (final JsonNode item : getItems(response)) {
            if (index >= start + count) {
                break;
            }
            putRecord(index++, convertItem(item));
        }
        LOGGER.debug("{}: {} records obtained from {}", this, index - start, uri);
        return Range.closedOpen(start, index);
    }

    @Override
    public Record getByID(final String identifier) throws ReaderException {
        final URI uri = buildRecordURI(identifier);
        if (uri == null) {
            return GetByIdBasedOnQuery.getByID(this, identifier);
        }
        final JsonNode response = getJson(uri);
        final JsonNode item = getRecordItem(response);
        if (item == null || item.isNull() || item.isMissingNode()) {
            throw new NotFoundException("No record with identifier " + identifier);
        }
        return convertItem(item);
    }

    /**
     * Retrieves and parses a JSON document.
     * 
     * @param uri
     *            the URI to retrieve
     * @return the parsed document
     * @throws ReaderException
     *             if retrieval fails or the response is not valid JSON
     */
    protected final JsonNode getJson(final URI uri) throws ReaderException {
        return this.transport.get(uri, ACCEPT, new HttpTransport.BodyParser<JsonNode>() {

            @Override
            public JsonNode parse(final InputStream stream, final Charset charset)
                    throws Exception {
                try {
                    return MAPPER.readTree(new InputStreamReader(stream, charset));
                } catch (final JsonProcessingException ex) {
                    throw new ReaderException("Malformed JSON response from " + uri + ": "
                            + ex.getOriginalMessage(), ex);
                }
            }

        });
    }

    /**
     * Builds the URI of a page of search results.
     * 
     * @param query
     *            the prepared query
     * @param offset
     *            the index of the first result, starting at 0
     * @param limit
     *            the maximum number of results
     * @return the URI
     * @throws ReaderException
     *             if the URI cannot be built
     */
    protected abstract URI buildPageURI(String query, int offset, int limit)
            throws ReaderException;

    /**
     * Builds the URI of a single record. By default there is no such URI and records are
     * looked up with a search query.
     * 
     * @param identifier
     *            the record identifier
     * @return the URI, or null
     * @throws ReaderException
     *             if the URI cannot be built
     */
    @Nullable
    protected URI buildRecordURI(final String identifier) throws ReaderException {
        return null;
    }

    /**
     * Extracts the record item from the response to a single-record request. By default the
     * whole response is the item.
     * 
     * @param response
     *            the parsed response
     * @return the item, or null if the record does not exist
     */
    @Nullable
    protected JsonNode getRecordItem(final JsonNode response) {
        return response;
    }

    protected abstract int getTotal(JsonNode response) throws ReaderException;

    protected abstract Iterable<JsonNode> getItems(JsonNode response) throws ReaderException;

    protected abstract Record convertItem(JsonNode item) throws ReaderException;

}
