package nl.uu.edpop.explorer.reader.sparql;

import java.io.StringReader;
import java.util.Map;

import com.google.common.collect.Maps;
import com.google.common.collect.Range;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.openrdf.model.Model;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.repository.Repository;
import org.openrdf.repository.RepositoryConnection;
import org.openrdf.repository.sail.SailRepository;
import org.openrdf.rio.RDFFormat;
import org.openrdf.sail.memory.MemoryStore;

import nl.uu.edpop.explorer.Catalog;
import nl.uu.edpop.explorer.ReaderException;
import nl.uu.edpop.explorer.ReaderType;
import nl.uu.edpop.explorer.data.BiographicalRecord;
import nl.uu.edpop.explorer.data.Data;
import nl.uu.edpop.explorer.data.Field;
import nl.uu.edpop.explorer.data.LocationField;
import nl.uu.edpop.explorer.data.Record;
import nl.uu.edpop.explorer.data.RecordException;
import nl.uu.edpop.explorer.vocabulary.EDPOPREC;

public class SparqlReaderTest {

    private static final Catalog CATALOG = Catalog
            .builder(Data.getValueFactory().createURI("http://example.com/readers/thesaurus"))
            .type(ReaderType.BIOGRAPHICAL).iriPrefix("http://example.com/thesaurus/")
            .fetchAllAtOnce(true).build();

    private static final URI SCHEMA_NAME = Data.getValueFactory().createURI(
            "http://schema.org/name");

    private static final URI SCHEMA_DESCRIPTION = Data.getValueFactory().createURI(
            "http://schema.org/description");

    private static final URI SCHEMA_BIRTH_PLACE = Data.getValueFactory().createURI(
            "http://schema.org/birthPlace");

    private static final String DATA = "" //
            + "@prefix schema: <http://schema.org/> .\n"
            + "@prefix ex: <http://example.com/thesaurus/> .\n"
            + "ex:p1 a schema:Person ; schema:name \"Jan Jansz\" ;\n"
            + "  schema:birthPlace \"Amsterdam\" ; schema:description \"Printer in Amsterdam\" .\n"
            + "ex:p2 a schema:Person ; schema:name \"Anna Visscher\" ;\n"
            + "  schema:birthPlace \"Amsterdam\" .\n"
            + "ex:o1 a schema:Organization ; schema:name \"Amsterdam Guild\" .\n"
            + "ex:p3 a schema:Person ; schema:name \"Pieter de \\\"Jonge\\\"\" .\n";

    private Repository repository;

    @Before
    public void setUp() throws Throwable {
        this.repository = new SailRepository(new MemoryStore());
        this.repository.initialize();
        final RepositoryConnection connection = this.repository.getConnection();
        try {
            connection.add(new StringReader(DATA), "http://example.com/", RDFFormat.TURTLE);
        } finally {
            connection.close();
        }
    }

    @After
    public void tearDown() throws Throwable {
        this.repository.shutDown();
    }

    private TestSparqlReader newReader(final String filter) {
        final TestSparqlReader reader = new TestSparqlReader(filter);
        reader.setRepository(this.repository);
        return reader;
    }

    @Test
    public void testSearch() throws Throwable {
        final TestSparqlReader reader = newReader("?s a schema:Person .");
        reader.prepareQuery("amsterdam");
        Assert.assertEquals(Range.closedOpen(0, 2), reader.fetch());
        Assert.assertEquals(Integer.valueOf(2), reader.getNumberOfResults());
        Assert.assertTrue(reader.isFetchingExhausted());
        Assert.assertEquals(Range.closedOpen(0, 0), reader.fetch());

        final SparqlBiographicalRecord first = (SparqlBiographicalRecord) reader.get(0);
        Assert.assertEquals("p1", first.getIdentifier());
        Assert.assertEquals("http://example.com/thesaurus/p1", first.getLink());
        Assert.assertEquals("http://example.com/thesaurus/p1", first.getSubjectIRI());
        Assert.assertEquals("Jan Jansz", first.toString());
        Assert.assertEquals("p2", reader.get(1).getIdentifier());
        Assert.assertEquals(0, reader.loads);
    }

    @Test
    public void testSearchWithoutFilter() throws Throwable {
        final TestSparqlReader reader = newReader("");
        reader.prepareQuery("AMSTERDAM");
        Assert.assertEquals(Range.closedOpen(0, 3), reader.fetch());
        Assert.assertEquals("o1", reader.get(0).getIdentifier());
    }

    @Test
    public void testLazyFetch() throws Throwable {
        final TestSparqlReader reader = newReader("?s a schema:Person .");
        reader.prepareQuery("amsterdam");
        reader.fetch();
        final SparqlBiographicalRecord record = (SparqlBiographicalRecord) reader.get(0);
        Assert.assertFalse(record.isFetched());
        Assert.assertEquals("Amsterdam", record.getPlaceOfBirth().getOriginalText());
        Assert.assertTrue(record.isFetched());
        final Model model = record.toGraph();
        Assert.assertTrue(model.contains(record.getIRI(), EDPOPREC.PLACE_OF_BIRTH, null));
        Assert.assertTrue(model.contains(record.getIRI(), EDPOPREC.NAME, null));
        Assert.assertEquals("Printer in Amsterdam", record.getDataMap().get(
                SCHEMA_DESCRIPTION.stringValue()));
        Assert.assertEquals(1, reader.loads);
    }

    @Test
    public void testGetByID() throws Throwable {
        final TestSparqlReader reader = newReader("");
        final Record record = reader.getByID("p2");
        Assert.assertTrue(record instanceof SparqlBiographicalRecord);
        Assert.assertEquals("p2", record.getIdentifier());
        Assert.assertEquals(0, reader.loads);
        Assert.assertEquals("Anna Visscher", ((BiographicalRecord) record).getName()
                .getOriginalText());
        Assert.assertEquals(1, reader.loads);
        Assert.assertFalse(reader.isFetchingStarted());
        Assert.assertEquals("p1", reader.getByIRI("http://example.com/thesaurus/p1")
                .getIdentifier());
    }

    @Test
    public void testGetByIDWithoutData() throws Throwable {
        final TestSparqlReader reader = newReader("");
        final SparqlBiographicalRecord record = (SparqlBiographicalRecord) reader
                .getByID("p9");
        try {
            record.fetch();
            Assert.fail();
        } catch (final RecordException ex) {
            Assert.assertTrue(ex.getMessage().contains("No data available"));
        }
        Assert.assertFalse(record.isFetched());
    }

    @Test
    public void testQueryEscaping() throws Throwable {
        final TestSparqlReader reader = newReader("");
        Assert.assertTrue(reader.transformQuery("de \"Jonge\"").contains(
                "regex(str(?o), \"de \\\"Jonge\\\"\", \"i\")"));
        reader.prepareQuery("de \"Jonge\"");
        Assert.assertEquals(Range.closedOpen(0, 1), reader.fetch());
        Assert.assertEquals("p3", reader.get(0).getIdentifier());
    }

    @Test
    public void testMalformedQuery() throws Throwable {
        final TestSparqlReader reader = newReader("?s a");
        reader.prepareQuery("amsterdam");
        try {
            reader.fetch();
            Assert.fail();
        } catch (final ReaderException ex) {
            Assert.assertTrue(ex.getMessage().startsWith("Malformed SPARQL query"));
        }
    }

    @Test
    public void testCatalogWithoutPrefix() {
        try {
            new SparqlReader(Catalog.builder(Data.getValueFactory().createURI(
                    "http://example.com/readers/noprefix")).build(), "http://example.com/sparql") {

                @Override
                protected void populate(final Record record, final String iri, final Model model) {
                }

            };
            Assert.fail();
        } catch (final IllegalArgumentException ex) {
            // expected
        }
    }

    private static final class TestSparqlReader extends SparqlReader {

        private final String filter;

        int loads;

        TestSparqlReader(final String filter) {
            super(CATALOG, "http://example.com/sparql");
            this.filter = filter;
        }

        @Override
        protected String getFilter() {
            return this.filter;
        }

        @Override
        protected void populate(final Record record, final String iri, final Model model) {
            ++this.loads;
            final BiographicalRecord person = (BiographicalRecord) record;
            final Map<String, Object> data = Maps.newLinkedHashMap();
            for (final Statement statement : model) {
                final String value = statement.getObject().stringValue();
                data.put(statement.getPredicate().stringValue(), value);
                if (statement.getPredicate().equals(SCHEMA_NAME)) {
                    person.setName(new Field(value));
                } else if (statement.getPredicate().equals(SCHEMA_BIRTH_PLACE)) {
                    person.setPlaceOfBirth(new LocationField(value));
                }
            }
            person.setData(data);
        }

    }

}
