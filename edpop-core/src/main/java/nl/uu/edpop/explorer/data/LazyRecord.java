package nl.uu.edpop.explorer.data;

/**
 * A record whose attributes are populated on first access rather than when it is created.
 * <p>
 * Implementations are {@link Record} subclasses that override {@link Record#fetch()} and
 * delegate to a {@link LazyRecordSupport} instance, which guarantees that the deferred retrieval
 * is performed at most once.
 * </p>
 */
public interface LazyRecord {

    /**
     * Returns whether the deferred retrieval has been performed successfully.
     * 
     * @return true if the record has been fetched
     */
    boolean isFetched();

    /**
     * Performs the deferred retrieval, if not done already.
     * 
     * @throws RecordException
     *             if the record has no identifier or the retrieval fails
     */
    void fetch() throws RecordException;

}
