package nl.uu.edpop.explorer;

import com.google.common.collect.Range;

import org.junit.Assert;
import org.junit.Test;

import nl.uu.edpop.explorer.data.Record;

public class GetByIdBasedOnQueryTest {

    @Test
    public void testFound() throws Throwable {
        final Record record = new LookupReader().getByID("10");
        Assert.assertEquals("10", record.getIdentifier());
    }

    @Test
    public void testManyMatching() throws Throwable {
        try {
            new LookupReader().getByID("manymatching");
            Assert.fail();
        } catch (final NotFoundException ex) {
            // expected
        }
    }

    @Test
    public void testNoneMatching() throws Throwable {
        try {
            new LookupReader().getByID("nonematching");
            Assert.fail();
        } catch (final NotFoundException ex) {
            // expected
        }
    }

    @Test
    public void testFirstMatchWins() throws Throwable {
        final Record record = new LookupReader().getByID("duplicate");
        Assert.assertEquals("duplicate", record.getIdentifier());
        Assert.assertEquals("first", record.getLink());
    }

    @Test
    public void testQueryStateUnaffected() throws Throwable {
        final LookupReader reader = new LookupReader();
        reader.setQuery("get 3");
        reader.getByID("5");
        Assert.assertFalse(reader.isFetchingStarted());
        Assert.assertEquals("get 3", reader.getPreparedQuery());
    }

    private static final class LookupReader extends SimpleReader implements
            QueryBasedLookup<String> {

        LookupReader() {
            super(Catalog.builder(SimpleReader.CATALOG.getURI()).fetchAllAtOnce(true).build());
        }

        @Override
        public Reader<String> newLookupReader() {
            return new LookupReader();
        }

        @Override
        public String prepareGetByIDQuery(final String identifier) {
            return "get " + identifier;
        }

        @Override
        public Range<Integer> fetchRange(final Range<Integer> range) throws ReaderException {
            final String query = getPreparedQuery();
            if ("get manymatching".equals(query)) {
                putRecord(0, new Record(getCatalog()));
                putRecord(1, new Record(getCatalog()));
                setNumberOfResults(2);
                return Range.closedOpen(0, 2);
            } else if ("get nonematching".equals(query)) {
                setNumberOfResults(0);
                return Range.closedOpen(0, 0);
            } else if ("get duplicate".equals(query)) {
                for (int i = 0; i < 2; ++i) {
                    final Record record = new Record(getCatalog());
                    record.setIdentifier("duplicate");
                    record.setLink(i == 0 ? "first" : "second");
                    putRecord(i, record);
                }
                setNumberOfResults(2);
                return Range.closedOpen(0, 2);
            }
            final Record record = new Record(getCatalog());
            record.setIdentifier(query.substring(4));
            putRecord(0, record);
            setNumberOfResults(1);
            return Range.closedOpen(0, 1);
        }

        @Override
        public Record getByID(final String identifier) throws ReaderException {
            return GetByIdBasedOnQuery.getByID(this, identifier);
        }

    }

}
