package nl.uu.edpop.explorer;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nl.uu.edpop.explorer.data.Record;

/**
 * Looks up single records using a search query.
 * <p>
 * A fresh reader is created, its query is set to the one returned by
 * {@link QueryBasedLookup#prepareGetByIDQuery(String)}, a single page is fetched and the first
 * record of the page having the requested identifier is returned.
 * </p>
 */
public final class GetByIdBasedOnQuery {

    private static final Logger LOGGER = LoggerFactory.getLogger(GetByIdBasedOnQuery.class);

    public static <Q> Record getByID(final QueryBasedLookup<Q> lookup, final String identifier)
            throws ReaderException {
        Preconditions.checkNotNull(identifier);
        final Reader<Q> reader = lookup.newLookupReader();
        reader.setQuery(lookup.prepareGetByIDQuery(identifier));
        reader.fetch();
        final Integer numberOfResults = reader.getNumberOfResults();
        if (numberOfResults == null || numberOfResults == 0) {
            throw new NotFoundException("No results returned for identifier " + identifier);
        }
        for (final Record record : reader.getRecords().values()) {
            if (identifier.equals(record.getIdentifier())) {
                return record;
            }
        }
        LOGGER.debug("{}: identifier {} not among {} fetched records", reader, identifier,
                reader.getNumberFetched());
        throw new NotFoundException("Record with identifier " + identifier
                + " not present among " + numberOfResults + " returned results");
    }

    private GetByIdBasedOnQuery() {
    }

}
