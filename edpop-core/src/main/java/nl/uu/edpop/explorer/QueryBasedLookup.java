package nl.uu.edpop.explorer;

/**
 * A reader whose catalog offers no direct record lookup, so that records are looked up by means
 * of a search query. Used together with {@link GetByIdBasedOnQuery}.
 * 
 * @param <Q>
 *            the type of prepared queries
 */
public interface QueryBasedLookup<Q> {

    /**
     * Creates a new reader of the same catalog, with no query set.
     * 
     * @return the new reader
     */
    Reader<Q> newLookupReader();

    /**
     * Returns a search query whose first page of results is expected to contain the record with
     * the identifier specified.
     * 
     * @param identifier
     *            the record identifier
     * @return the prepared query
     */
    Q prepareGetByIDQuery(String identifier);

}
