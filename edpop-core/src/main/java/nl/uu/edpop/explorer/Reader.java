package nl.uu.edpop.explorer;

import java.util.Collections;
import java.util.NavigableMap;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;
import com.google.common.collect.Range;

import org.openrdf.model.Model;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nl.uu.edpop.explorer.data.Record;

/**
 * Base class of catalog readers.
 * <p>
 * A reader executes a query against a catalog and collects the resulting {@link Record}s. To use
 * a reader, set a query with {@link #prepareQuery(String)} or {@link #setQuery(Object)}, then call
 * {@link #fetch()} or {@link #fetch(Integer)} repeatedly until enough records are available or
 * {@link #isFetchingExhausted()} returns true. Fetched records are stored in a sparse collection
 * indexed by their rank in the result list (see {@link #getRecords()}), which is populated
 * monotonically: records are never removed.
 * </p>
 * <p>
 * Concrete readers declare a static {@link Catalog} and implement
 * {@link #transformQuery(String)}, {@link #fetchRange(Range)} and {@link #getByID(String)}.
 * {@code fetchRange} stores records with {@link #putRecord(int, Record)} and the total number of
 * results with {@link #setNumberOfResults(int)}. Readers are not thread safe.
 * </p>
 * 
 * @param <Q>
 *            the type of prepared queries; it must implement {@link Object#equals(Object)} and
 *            {@link Object#toString()} based on the query content
 */
public abstract class Reader<Q> {

    private static final Logger LOGGER = LoggerFactory.getLogger(Reader.class);

    private final Catalog catalog;

    private final NavigableMap<Integer, Record> records;

    @Nullable
    private Integer numberOfResults;

    @Nullable
    private Q preparedQuery;

    private int fetchPosition;

    protected Reader(final Catalog catalog) {
        this.catalog = Preconditions.checkNotNull(catalog);
        this.records = Maps.newTreeMap();
    }

    public final Catalog getCatalog() {
        return this.catalog;
    }

    /**
     * Converts a user query to the query representation used by the catalog.
     * 
     * @param query
     *            the user query
     * @return the prepared query
     */
    public abstract Q transformQuery(String query);

    /**
     * Prepares and sets the user query specified.
     * 
     * @param query
     *            the user query
     * @throws ReaderException
     *             if fetching already started with a different query
     */
    public final void prepareQuery(final String query) throws ReaderException {
        setQuery(transformQuery(Preconditions.checkNotNull(query)));
    }

    /**
     * Sets the prepared query. The query can be changed only until fetching starts.
     * 
     * @param query
     *            the prepared query
     * @throws ReaderException
     *             if fetching already started with a different query
     */
    public final void setQuery(final Q query) throws ReaderException {
        Preconditions.checkNotNull(query);
        if (isFetchingStarted() && !query.equals(this.preparedQuery)) {
            throw new ReaderException("Cannot change query of " + this
                    + " after fetching started");
        }
        this.preparedQuery = query;
    }

    @Nullable
    public final Q getPreparedQuery() {
        return this.preparedQuery;
    }

    /**
     * Skips the first records of the result list, so that the next {@link #fetch()} starts at
     * the index specified. Readers fetching all records at once may ignore this setting.
     * 
     * @param startIndex
     *            the index of the first record to fetch
     * @throws ReaderException
     *             if fetching already started
     */
    public final void adjustStartRecord(final int startIndex) throws ReaderException {
        Preconditions.checkArgument(startIndex >= 0, "Negative start index %s", startIndex);
        if (isFetchingStarted()) {
            throw new ReaderException("Cannot adjust start record of " + this
                    + " after fetching started");
        }
        this.fetchPosition = startIndex;
    }

    /**
     * Fetches the next page of records, using the default number of records per page of the
     * catalog.
     * 
     * @return the range of indexes actually fetched, empty if fetching is exhausted
     * @throws ReaderException
     *             if no query is set or the catalog cannot be queried
     */
    public final Range<Integer> fetch() throws ReaderException {
        return fetch(null);
    }

    /**
     * Fetches the next records, starting after the last record fetched by this method.
     * 
     * @param number
     *            the number of records to fetch, null for the catalog default
     * @return the range of indexes actually fetched, empty if fetching is exhausted
     * @throws ReaderException
     *             if no query is set or the catalog cannot be queried
     */
    public final Range<Integer> fetch(@Nullable final Integer number) throws ReaderException {
        Preconditions.checkArgument(number == null || number > 0, "Invalid number %s", number);
        if (isFetchingExhausted()) {
            return Range.closedOpen(0, 0);
        }
        if (this.numberOfResults != null && this.fetchPosition >= this.numberOfResults) {
            return Range.closedOpen(this.fetchPosition, this.fetchPosition);
        }
        checkQuery();
        final int count = number != null ? number : this.catalog.getDefaultRecordsPerPage();
        final Range<Integer> requested = Range.closedOpen(this.fetchPosition, this.fetchPosition
                + count);
        final Range<Integer> fetched = fetchRange(requested);
        if (!fetched.isEmpty()) {
            this.fetchPosition = fetched.upperEndpoint();
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("{}: requested {}, fetched {}, {} of {} results available", this,
                    requested, fetched, getNumberFetched(), this.numberOfResults);
        }
        return fetched;
    }

    /**
     * Fetches the records with the indexes in the range specified. The range may extend past the
     * end of the result list, in which case only the existing records are fetched.
     * 
     * @param range
     *            a closed-open range of indexes
     * @return the closed-open range of indexes actually fetched
     * @throws ReaderException
     *             if the catalog cannot be queried
     */
    public abstract Range<Integer> fetchRange(Range<Integer> range) throws ReaderException;

    /**
     * Returns the record at the index specified, fetching it if necessary.
     * 
     * @param index
     *            the record index
     * @return the record
     * @throws NotFoundException
     *             if the record is not available
     * @throws ReaderException
     *             if fetching fails
     */
    public final Record get(final int index) throws ReaderException {
        return get(index, true);
    }

    /**
     * Returns the record at the index specified.
     * 
     * @param index
     *            the record index
     * @param allowFetching
     *            whether the record may be fetched from the catalog if not available yet
     * @return the record
     * @throws NotFoundException
     *             if the record is not available
     * @throws ReaderException
     *             if fetching fails
     */
    public final Record get(final int index, final boolean allowFetching)
            throws ReaderException {
        Record record = this.records.get(index);
        if (record == null && allowFetching && index >= 0
                && (this.numberOfResults == null || index < this.numberOfResults)) {
            checkQuery();
            fetchRange(Range.closedOpen(index, index + 1));
            record = this.records.get(index);
        }
        if (record == null) {
            throw new NotFoundException("Item with index " + index + " is not available");
        }
        return record;
    }

    /**
     * Retrieves a single record by its catalog-local identifier. The query state of this reader
     * is not affected.
     * 
     * @param identifier
     *            the identifier
     * @return the record
     * @throws NotFoundException
     *             if no record has that identifier
     * @throws ReaderException
     *             if the catalog cannot be queried
     */
    public abstract Record getByID(String identifier) throws ReaderException;

    /**
     * Retrieves a single record by its IRI.
     * 
     * @param iri
     *            the record IRI
     * @return the record
     * @throws NotFoundException
     *             if no record has that IRI
     * @throws ReaderException
     *             if the IRI is not valid for the catalog or the catalog cannot be queried
     */
    public Record getByIRI(final String iri) throws ReaderException {
        return getByID(this.catalog.iriToIdentifier(iri));
    }

    public final Model catalogToGraph() {
        return this.catalog.toGraph();
    }

    /**
     * Returns the records fetched so far.
     * 
     * @return an unmodifiable sorted map from record index to record, possibly with gaps
     */
    public final NavigableMap<Integer, Record> getRecords() {
        return Collections.unmodifiableNavigableMap(this.records);
    }

    public final int getNumberFetched() {
        return this.records.size();
    }

    /**
     * Returns the total number of results.
     * 
     * @return the number of results, or null if fetching did not start
     */
    @Nullable
    public final Integer getNumberOfResults() {
        return this.numberOfResults;
    }

    public final boolean isFetchingStarted() {
        return this.numberOfResults != null;
    }

    /**
     * Returns whether all the results have been fetched. After {@link #adjustStartRecord(int)}
     * the skipped records are never fetched, so this stays false; use {@link #hasMore()} to
     * know whether {@link #fetch()} can return further records.
     * 
     * @return true if every result is available in {@link #getRecords()}
     */
    public final boolean isFetchingExhausted() {
        return this.numberOfResults != null && this.numberOfResults == this.records.size();
    }

    /**
     * Returns whether a further {@link #fetch()} may return records, taking the fetch cursor
     * into account.
     * 
     * @return false if fetching is exhausted or the cursor reached the number of results
     */
    public final boolean hasMore() {
        return !isFetchingExhausted()
                && (this.numberOfResults == null || this.fetchPosition < this.numberOfResults);
    }

    /**
     * Stores a fetched record.
     * 
     * @param index
     *            the record index
     * @param record
     *            the record
     */
    protected final void putRecord(final int index, final Record record) {
        Preconditions.checkArgument(index >= 0, "Negative index %s", index);
        this.records.put(index, Preconditions.checkNotNull(record));
    }

    /**
     * Sets the total number of results, as soon as it is known.
     * 
     * @param numberOfResults
     *            the number of results
     */
    protected final void setNumberOfResults(final int numberOfResults) {
        Preconditions.checkArgument(numberOfResults >= 0, "Negative number of results %s",
                numberOfResults);
        this.numberOfResults = numberOfResults;
    }

    /**
     * Restricts a requested range to the known number of results.
     * 
     * @param range
     *            a closed-open range
     * @param total
     *            the number of results
     * @return the closed-open range of existing indexes in the range specified
     */
    protected static Range<Integer> truncate(final Range<Integer> range, final int total) {
        final int lower = Math.min(range.lowerEndpoint(), total);
        return Range.closedOpen(lower, Math.max(lower, Math.min(range.upperEndpoint(), total)));
    }

    /**
     * Returns an identifier of the reader that depends only on the reader class and the
     * prepared query, allowing a session to be resumed by a new reader instance.
     * 
     * @return the identifier
     * @throws IllegalStateException
     *             if no query is set
     */
    public final String generateIdentifier() {
        Preconditions.checkState(this.preparedQuery != null, "A prepared query should be set first");
        return getClass().getName() + " | " + this.preparedQuery;
    }

    private void checkQuery() throws ReaderException {
        if (this.preparedQuery == null) {
            throw new ReaderException("No query set for " + this);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + " (" + this.catalog.getShortName() + ")";
    }

}
