package nl.uu.edpop.explorer.reader.sru;

import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.Charset;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;
import com.google.common.collect.Range;

import org.apache.http.client.utils.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nl.uu.edpop.explorer.Catalog;
import nl.uu.edpop.explorer.GetByIdBasedOnQuery;
import nl.uu.edpop.explorer.QueryBasedLookup;
import nl.uu.edpop.explorer.Reader;
import nl.uu.edpop.explorer.ReaderException;
import nl.uu.edpop.explorer.data.Record;
import nl.uu.edpop.explorer.reader.http.HttpTransport;

/**
 * Base class of readers of catalogs offering an SRU (Search/Retrieve via URL) API.
 * <p>
 * Queries are CQL strings produced by {@link #transformQuery(String)}. Pages of results are
 * retrieved with {@code searchRetrieve} requests, whose record payloads are parsed by the
 * {@link SRURecordParser} returned by {@link #newRecordParser()} and converted to records by
 * {@link #convertRecord(Object)}. Single records are looked up with a search query, by default
 * the transformed identifier (see {@link #prepareGetByIDQuery(String)}).
 * </p>
 * 
 * @param <T>
 *            the type of parsed record payloads
 */
public abstract class SRUReader<T> extends Reader<String> implements QueryBasedLookup<String> {

    public static final String VERSION_1_1 = "1.1";

    public static final String VERSION_1_2 = "1.2";

    private static final Logger LOGGER = LoggerFactory.getLogger(SRUReader.class);

    private static final String ACCEPT = "application/xml, text/xml;q=0.9, */*;q=0.1";

    private final String sruURL;

    private final String sruVersion;

    @Nullable
    private String recordSchema;

    private final Map<String, String> extraParameters;

    private HttpTransport transport;

    protected SRUReader(final Catalog catalog, final String sruURL, final String sruVersion) {
        super(catalog);
        Preconditions.checkArgument(VERSION_1_1.equals(sruVersion)
                || VERSION_1_2.equals(sruVersion), "Unsupported SRU version %s", sruVersion);
        this.sruURL = Preconditions.checkNotNull(sruURL);
        this.sruVersion = sruVersion;
        this.extraParameters = Maps.newLinkedHashMap();
        this.transport = HttpTransport.getDefault();
    }

    public final String getSruURL() {
        return this.sruURL;
    }

    public final String getSruVersion() {
        return this.sruVersion;
    }

    @Nullable
    public final String getRecordSchema() {
        return this.recordSchema;
    }

    /**
     * Sets the record schema requested from the server.
     * 
     * @param recordSchema
     *            the schema name, or null for the default schema of the server
     */
    protected final void setRecordSchema(@Nullable final String recordSchema) {
        this.recordSchema = recordSchema;
    }

    /**
     * Adds a request parameter sent with every {@code searchRetrieve} request, as required by
     * some servers (e.g., an API key).
     * 
     * @param name
     *            the parameter name
     * @param value
     *            the parameter value
     */
    protected final void setExtraParameter(final String name, final String value) {
        this.extraParameters.put(Preconditions.checkNotNull(name),
                Preconditions.checkNotNull(value));
    }

    public final void setTransport(final HttpTransport transport) {
        this.transport = Preconditions.checkNotNull(transport);
    }

    protected final HttpTransport getTransport() {
        return this.transport;
    }

    /**
     * Creates the parser for the record payloads returned by the server.
     * 
     * @return a new parser
     */
    protected abstract SRURecordParser<T> newRecordParser();

    /**
     * Converts a parsed record payload to a record.
     * 
     * @param data
     *            the parsed payload
     * @return the record
     * @throws ReaderException
     *             if the payload cannot be converted
     */
    protected abstract Record convertRecord(T data) throws ReaderException;

    @Override
    public String prepareGetByIDQuery(final String identifier) {
        return transformQuery(identifier);
    }

    @Override
    public Record getByID(final String identifier) throws ReaderException {
        return GetByIdBasedOnQuery.getByID(this, identifier);
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
        final URI uri = buildURI(query, start + 1, count); // SRU starts at 1
        final SRUResponse<T> response = this.transport.get(uri, ACCEPT,
                new HttpTransport.BodyParser<SRUResponse<T>>() {

                    @Override
                    public SRUResponse<T> parse(final InputStream stream,
                            final Charset charset) throws Exception {
                        return SRUResponse.parse(stream, newRecordParser());
                    }

                });
        if (response.getDiagnostic() != null) {
            throw new ReaderException("Server returned error: " + response.getDiagnostic());
        }
        final int numberOfRecords = response.getNumberOfRecords();
        setNumberOfResults(numberOfRecords);
        final List<T> payloads = response.getRecords();
        final int fetched = Math.max(0, Math.min(Math.min(payloads.size(), count),
                numberOfRecords - start));
        for (int i = 0; i < fetched; ++i) {
            putRecord(start + i, convertRecord(payloads.get(i)));
        }
        LOGGER.debug("{}: {} records obtained from {}", this, fetched, uri);
        return Range.closedOpen(start, start + fetched);
    }

    /**
     * Builds the URI of a {@code searchRetrieve} request.
     * 
     * @param query
     *            the CQL query
     * @param startRecord
     *            the position of the first record, starting at 1
     * @param maximumRecords
     *            the maximum number of records to return
     * @return the request URI
     * @throws ReaderException
     *             if the SRU URL is invalid
     */
    protected URI buildURI(final String query, final int startRecord, final int maximumRecords)
            throws ReaderException {
        try {
            final URIBuilder builder = new URIBuilder(this.sruURL);
            builder.addParameter("operation", "searchRetrieve");
            builder.addParameter("version", this.sruVersion);
            builder.addParameter("query", query);
            builder.addParameter("startRecord", Integer.toString(startRecord));
            builder.addParameter("maximumRecords", Integer.toString(maximumRecords));
            if (this.recordSchema != null) {
                builder.addParameter("recordSchema", this.recordSchema);
            }
            for (final Map.Entry<String, String> entry : this.extraParameters.entrySet()) {
                builder.addParameter(entry.getKey(), entry.getValue());
            }
            return builder.build();
        } catch (final URISyntaxException ex) {
            throw new ReaderException("Invalid SRU URL " + this.sruURL, ex);
        }
    }

}
