package nl.uu.edpop.explorer.reader.api;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Range;

import org.apache.http.client.utils.URIBuilder;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import nl.uu.edpop.explorer.Catalog;
import nl.uu.edpop.explorer.NotFoundException;
import nl.uu.edpop.explorer.ReaderException;
import nl.uu.edpop.explorer.ReaderType;
import nl.uu.edpop.explorer.data.BibliographicalRecord;
import nl.uu.edpop.explorer.data.Data;
import nl.uu.edpop.explorer.data.Field;
import nl.uu.edpop.explorer.data.Record;
import nl.uu.edpop.explorer.reader.TestHttpServer;

public class JsonApiReaderTest {

    private static final Catalog CATALOG = Catalog
            .builder(Data.getValueFactory().createURI("http://example.com/readers/json"))
            .type(ReaderType.BIBLIOGRAPHICAL).iriPrefix("http://example.com/records/json/")
            .defaultRecordsPerPage(2).build();

    private static final List<String> TITLES = ImmutableList.of("Almanak 1701",
            "Almanak 1702", "Almanak 1703", "Almanak 1704", "Almanak 1705");

    private TestHttpServer server;

    @Before
    public void setUp() throws Throwable {
        this.server = new TestHttpServer(new TestHttpServer.Responder() {

            @Override
            public TestHttpServer.Response respond(final String path,
                    final Map<String, String> parameters) {
                if (path.startsWith("/records/")) {
                    final String id = path.substring("/records/".length());
                    final int index = id.startsWith("b") ? Integer.parseInt(id.substring(1)) : -1;
                    return json(index >= 0 && index < TITLES.size() ? "{\"record\":"
                            + item(index) + "}" : "{\"record\":null}");
                } else if ("broken".equals(parameters.get("q"))) {
                    return json("{\"total\": 1, \"items\": [");
                }
                final int offset = Integer.parseInt(parameters.get("offset"));
                final int limit = Integer.parseInt(parameters.get("limit"));
                final List<String> items = Lists.newArrayList();
                for (int i = offset; i < Math.min(offset + limit, TITLES.size()); ++i) {
                    items.add(item(i));
                }
                return json("{\"total\":" + TITLES.size() + ",\"items\":["
                        + Joiner.on(',').join(items) + "]}");
            }

        });
    }

    @After
    public void tearDown() {
        this.server.close();
    }

    private static String item(final int index) {
        return "{\"id\":\"b" + index + "\",\"title\":\"" + TITLES.get(index) + "\"}";
    }

    private static TestHttpServer.Response json(final String body) {
        return new TestHttpServer.Response(200, "application/json", body);
    }

    @Test
    public void testFetch() throws Throwable {
        final TestJsonReader reader = new TestJsonReader(this.server.getURL(""), true);
        reader.prepareQuery("almanak");
        Assert.assertEquals(Range.closedOpen(0, 2), reader.fetch());
        Assert.assertEquals(Integer.valueOf(5), reader.getNumberOfResults());
        Assert.assertEquals(Range.closedOpen(2, 4), reader.fetch());
        Assert.assertEquals(Range.closedOpen(4, 5), reader.fetch());
        Assert.assertTrue(reader.isFetchingExhausted());
        Assert.assertEquals(3, this.server.getRequests().size());

        final Map<String, String> parameters = TestHttpServer.parseQuery(this.server
                .getRequests().get(1).getRawQuery());
        Assert.assertEquals("almanak", parameters.get("q"));
        Assert.assertEquals("2", parameters.get("offset"));
        Assert.assertEquals("2", parameters.get("limit"));

        final BibliographicalRecord record = (BibliographicalRecord) reader.get(3);
        Assert.assertEquals("b3", record.getIdentifier());
        Assert.assertEquals("Almanak 1703", record.getTitle().getOriginalText());
        Assert.assertEquals("b3", record.getDataMap().get("id"));
    }

    @Test
    public void testGetSingle() throws Throwable {
        final TestJsonReader reader = new TestJsonReader(this.server.getURL(""), true);
        reader.prepareQuery("almanak");
        Assert.assertEquals("Almanak 1704", reader.get(4).toString());
        Assert.assertEquals(1, reader.getNumberFetched());
        try {
            reader.get(5);
            Assert.fail();
        } catch (final NotFoundException ex) {
            // expected
        }
    }

    @Test
    public void testGetByID() throws Throwable {
        final TestJsonReader reader = new TestJsonReader(this.server.getURL(""), true);
        Assert.assertEquals("Almanak 1702", reader.getByID("b1").toString());
        Assert.assertEquals("/records/b1", this.server.getRequests().get(0).getPath());
        try {
            reader.getByID("b9");
            Assert.fail();
        } catch (final NotFoundException ex) {
            // expected
        }
    }

    @Test
    public void testGetByIDBasedOnQuery() throws Throwable {
        final TestJsonReader reader = new TestJsonReader(this.server.getURL(""), false);
        Assert.assertEquals("Almanak 1701", reader.getByID("b0").toString());
        Assert.assertEquals("b0", TestHttpServer.parseQuery(
                this.server.getRequests().get(0).getRawQuery()).get("q"));
    }

    @Test
    public void testMalformedResponse() throws Throwable {
        final TestJsonReader reader = new TestJsonReader(this.server.getURL(""), true);
        reader.prepareQuery("broken");
        try {
            reader.fetch();
            Assert.fail();
        } catch (final ReaderException ex) {
            Assert.assertTrue(ex.getMessage().startsWith("Malformed JSON response"));
        }
    }

    @Test
    public void testUnreachableServer() throws Throwable {
        final String url = this.server.getURL("");
        this.server.close();
        final TestJsonReader reader = new TestJsonReader(url, true);
        reader.prepareQuery("almanak");
        try {
            reader.fetch();
            Assert.fail();
        } catch (final ReaderException ex) {
            Assert.assertTrue(ex.getMessage().startsWith("Could not retrieve"));
        }
    }

    private static final class TestJsonReader extends JsonApiReader {

        private final String url;

        private final boolean recordEndpoint;

        TestJsonReader(final String url, final boolean recordEndpoint) {
            super(CATALOG);
            this.url = url;
            this.recordEndpoint = recordEndpoint;
        }

        @Override
        public TestJsonReader newLookupReader() {
            return new TestJsonReader(this.url, this.recordEndpoint);
        }

        @Override
        protected URI buildPageURI(final String query, final int offset, final int limit)
                throws ReaderException {
            try {
                return new URIBuilder(this.url + "/search").addParameter("q", query)
                        .addParameter("offset", Integer.toString(offset))
                        .addParameter("limit", Integer.toString(limit)).build();
            } catch (final URISyntaxException ex) {
                throw new ReaderException("Invalid URL", ex);
            }
        }

        @Override
        protected URI buildRecordURI(final String identifier) {
            return this.recordEndpoint ? URI.create(this.url + "/records/" + identifier) : null;
        }

        @Override
        protected JsonNode getRecordItem(final JsonNode response) {
            return response.path("record");
        }

        @Override
        protected int getTotal(final JsonNode response) throws ReaderException {
            if (!response.path("total").isInt()) {
                throw new ReaderException("Missing total");
            }
            return response.path("total").asInt();
        }

        @Override
        protected Iterable<JsonNode> getItems(final JsonNode response) {
            return response.path("items");
        }

        @Override
        protected Record convertItem(final JsonNode item) {
            final BibliographicalRecord record = new BibliographicalRecord(CATALOG);
            final Map<String, Object> data = Maps.newLinkedHashMap();
            data.put("id", item.path("id").asText());
            data.put("title", item.path("title").asText());
            record.setData(data);
            record.setIdentifier(item.path("id").asText());
            record.setTitle(new Field(item.path("title").asText()));
            return record;
        }

    }

}
