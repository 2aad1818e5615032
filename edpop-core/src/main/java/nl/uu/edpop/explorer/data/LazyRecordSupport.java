package nl.uu.edpop.explorer.data;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helper implementing the fetch-once logic of {@link LazyRecord}s.
 * <p>
 * The first call to {@link #fetch()} invokes the {@link Loader}; after it completes successfully
 * further calls do nothing. Calls made while the loader is running (e.g., because the loader
 * reads attributes of the record) return immediately. A failed fetch can be retried.
 * </p>
 */
public final class LazyRecordSupport {

    private static final Logger LOGGER = LoggerFactory.getLogger(LazyRecordSupport.class);

    private final Record record;

    private final Loader loader;

    private boolean fetched;

    private boolean fetching;

    public LazyRecordSupport(final Record record, final Loader loader) {
        this.record = Preconditions.checkNotNull(record);
        this.loader = Preconditions.checkNotNull(loader);
    }

    public boolean isFetched() {
        return this.fetched;
    }

    public void fetch() throws RecordException {
        if (this.fetched || this.fetching) {
            return;
        }
        final String identifier = this.record.getIdentifier();
        if (identifier == null) {
            throw new RecordException("Cannot fetch a " + this.record.getClass().getSimpleName()
                    + " without identifier");
        }
        this.fetching = true;
        try {
            LOGGER.debug("Fetching record {} from {}", identifier, this.record.getCatalog());
            this.loader.load();
            this.fetched = true;
        } catch (final RecordException ex) {
            throw ex;
        } catch (final Exception ex) {
            throw new RecordException("Could not fetch record " + identifier + ": "
                    + ex.getMessage(), ex);
        } finally {
            this.fetching = false;
        }
    }

    /**
     * Performs the deferred retrieval of a record, populating its attributes.
     */
    public interface Loader {

        void load() throws Exception;

    }

}
