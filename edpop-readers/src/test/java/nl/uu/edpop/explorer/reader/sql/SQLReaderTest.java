package nl.uu.edpop.explorer.reader.sql;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Range;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import nl.uu.edpop.explorer.Catalog;
import nl.uu.edpop.explorer.NotFoundException;
import nl.uu.edpop.explorer.ReaderException;
import nl.uu.edpop.explorer.ReaderType;
import nl.uu.edpop.explorer.data.BibliographicalRecord;
import nl.uu.edpop.explorer.data.ContributorField;
import nl.uu.edpop.explorer.data.Data;
import nl.uu.edpop.explorer.data.DatingField;
import nl.uu.edpop.explorer.data.Field;
import nl.uu.edpop.explorer.data.LanguageField;
import nl.uu.edpop.explorer.data.Record;
import nl.uu.edpop.explorer.internal.Settings;

public class SQLReaderTest {

    private static final Catalog CATALOG = Catalog
            .builder(Data.getValueFactory().createURI("http://example.com/readers/sql"))
            .type(ReaderType.BIBLIOGRAPHICAL).iriPrefix("http://example.com/records/sql/")
            .fetchAllAtOnce(true).build();

    private static final String FILENAME = "books.sqlite3";

    private Path dataDir;

    @Before
    public void setUp() throws Throwable {
        this.dataDir = Files.createTempDirectory("edpop-sql");
        Settings.setDefault(Settings.builder().dataDir(this.dataDir.toFile()).build());
        final File file = new File(this.dataDir.toFile(), FILENAME);
        final Connection connection = DriverManager.getConnection("jdbc:sqlite:"
                + file.getAbsolutePath());
        try {
            final Statement statement = connection.createStatement();
            try {
                statement.executeUpdate("CREATE TABLE books (book_code TEXT PRIMARY KEY, "
                        + "full_book_title TEXT, languages TEXT, stated_publication_years TEXT)");
                statement.executeUpdate("CREATE TABLE authors (author_code TEXT, "
                        + "author_name TEXT)");
                statement.executeUpdate("CREATE TABLE books_authors (book_code TEXT, "
                        + "author_code TEXT)");
                statement.executeUpdate("INSERT INTO books VALUES "
                        + "('b1', 'Almanach royal', 'French', '1750'), "
                        + "('b2', 'Almanach des muses', 'French, Latin', '1765-70'), "
                        + "('b3', 'Histoire naturelle', 'French', NULL)");
                statement.executeUpdate("INSERT INTO authors VALUES "
                        + "('a1', 'Buffon'), ('a2', 'Daubenton')");
                statement.executeUpdate("INSERT INTO books_authors VALUES "
                        + "('b3', 'a1'), ('b3', 'a2')");
            } finally {
                statement.close();
            }
        } finally {
            connection.close();
        }
    }

    @After
    public void tearDown() throws Throwable {
        Settings.setDefault(null);
        MoreFiles.deleteRecursively(this.dataDir, RecursiveDeleteOption.ALLOW_INSECURE);
    }

    @Test
    public void testFetch() throws Throwable {
        final TestSQLReader reader = new TestSQLReader(FILENAME);
        reader.prepareQuery("almanach");
        Assert.assertEquals(new SQLQuery("WHERE B.full_book_title LIKE ?", "%almanach%"),
                reader.getPreparedQuery());
        Assert.assertEquals(Range.closedOpen(0, 2), reader.fetch(1));
        Assert.assertTrue(reader.isFetchingExhausted());
        Assert.assertEquals(Range.closedOpen(0, 0), reader.fetch());

        final BibliographicalRecord record = (BibliographicalRecord) reader.get(1);
        Assert.assertEquals("b2", record.getIdentifier());
        Assert.assertEquals("Almanach des muses", record.getTitle().getOriginalText());
        Assert.assertEquals("1765/1770", record.getDating().getEDTF().toString());
        final List<LanguageField> languages = record.getLanguages();
        Assert.assertEquals(2, languages.size());
        Assert.assertEquals("lat", languages.get(1).getLanguageCode());
        Assert.assertTrue(record.getContributors().isEmpty());
        Assert.assertEquals("1765-70", record.getDataMap().get("stated_publication_years"));
    }

    @Test
    public void testJoinedRows() throws Throwable {
        final TestSQLReader reader = new TestSQLReader(FILENAME);
        reader.prepareQuery("histoire");
        reader.fetch();
        Assert.assertEquals(Integer.valueOf(1), reader.getNumberOfResults());
        final BibliographicalRecord record = (BibliographicalRecord) reader.get(0);
        Assert.assertNull(record.getDating());
        final List<ContributorField> contributors = record.getContributors();
        Assert.assertEquals(2, contributors.size());
        Assert.assertEquals("Buffon", contributors.get(0).getName());
        Assert.assertEquals("Daubenton", contributors.get(1).getName());
    }

    @Test
    public void testNoResults() throws Throwable {
        final TestSQLReader reader = new TestSQLReader(FILENAME);
        reader.prepareQuery("encyclopédie");
        Assert.assertEquals(Range.closedOpen(0, 0), reader.fetch());
        Assert.assertEquals(Integer.valueOf(0), reader.getNumberOfResults());
        Assert.assertTrue(reader.isFetchingExhausted());
    }

    @Test
    public void testGetByID() throws Throwable {
        final TestSQLReader reader = new TestSQLReader(FILENAME);
        Assert.assertEquals("Histoire naturelle", reader.getByID("b3").toString());
        Assert.assertEquals("Almanach royal", reader.getByIRI("http://example.com/records/sql/b1")
                .toString());
        try {
            reader.getByID("b4");
            Assert.fail();
        } catch (final NotFoundException ex) {
            // expected
        }
    }

    @Test
    public void testMissingDatabase() throws Throwable {
        final TestSQLReader reader = new TestSQLReader("missing.sqlite3");
        reader.prepareQuery("almanach");
        try {
            reader.fetch();
            Assert.fail();
        } catch (final ReaderException ex) {
            Assert.assertTrue(ex.getMessage().contains("missing.sqlite3"));
            Assert.assertTrue(ex.getMessage().contains(this.dataDir.toFile().getPath()));
        }
    }

    @Test
    public void testInvalidStatement() throws Throwable {
        final TestSQLReader reader = new TestSQLReader(FILENAME);
        reader.setQuery(new SQLQuery("WHERE no_such_column = ?", "x"));
        try {
            reader.fetch();
            Assert.fail();
        } catch (final ReaderException ex) {
            Assert.assertTrue(ex.getCause() instanceof SQLException);
        }
        Assert.assertNull(reader.getNumberOfResults());
    }

    @Test
    public void testGenerateIdentifier() throws Throwable {
        final TestSQLReader reader = new TestSQLReader(FILENAME);
        reader.prepareQuery("almanach");
        Assert.assertEquals(TestSQLReader.class.getName()
                + " | WHERE B.full_book_title LIKE ? [%almanach%]", reader.generateIdentifier());
    }

    private static final class TestSQLReader extends SQLReader {

        TestSQLReader(final String filename) {
            super(CATALOG, new DatabaseFile(filename, null));
        }

        @Override
        public SQLQuery transformQuery(final String query) {
            return new SQLQuery("WHERE B.full_book_title LIKE ?", "%" + query + "%");
        }

        @Override
        public SQLQuery prepareGetByIDQuery(final String identifier) {
            return new SQLQuery("WHERE B.book_code = ?", identifier);
        }

        @Override
        public TestSQLReader newLookupReader() {
            return new TestSQLReader(getDatabaseFile().getFilename());
        }

        @Override
        protected String getSelectStatement() {
            return "SELECT B.*, A.author_name FROM books B "
                    + "LEFT OUTER JOIN books_authors BA ON B.book_code = BA.book_code "
                    + "LEFT OUTER JOIN authors A ON BA.author_code = A.author_code";
        }

        @Override
        protected String buildStatement(final SQLQuery query) {
            return super.buildStatement(query) + " ORDER BY B.book_code, A.author_name";
        }

        @Override
        protected List<Record> readRecords(final ResultSet resultSet) throws SQLException,
                ReaderException {
            final List<Record> records = Lists.newArrayList();
            final List<Map<String, Object>> rows = Lists.newArrayList();
            String lastCode = null;
            while (resultSet.next()) {
                final String code = resultSet.getString("book_code");
                if (!code.equals(lastCode)) {
                    final Map<String, Object> row = Maps.newLinkedHashMap();
                    row.put("book_code", code);
                    row.put("full_book_title", resultSet.getString("full_book_title"));
                    row.put("languages", resultSet.getString("languages"));
                    row.put("stated_publication_years",
                            resultSet.getString("stated_publication_years"));
                    row.put("authors", Lists.<String>newArrayList());
                    rows.add(row);
                    lastCode = code;
                }
                final String author = resultSet.getString("author_name");
                if (author != null) {
                    @SuppressWarnings("unchecked")
                    final List<String> authors = (List<String>) rows.get(rows.size() - 1)
                            .get("authors");
                    authors.add(author);
                }
            }
            for (final Map<String, Object> row : rows) {
                records.add(convertRow(row));
            }
            return records;
        }

        @Override
        protected Record convertRow(final Map<String, Object> row) {
            final BibliographicalRecord record = new BibliographicalRecord(CATALOG);
            record.setData(row);
            record.setIdentifier((String) row.get("book_code"));
            record.setTitle(new Field((String) row.get("full_book_title")));
            final String years = (String) row.get("stated_publication_years");
            if (years != null) {
                final DatingField dating = new DatingField(years);
                dating.normalize();
                record.setDating(dating);
            }
            final List<LanguageField> languages = Lists.newArrayList();
            for (final String language : ((String) row.get("languages")).split(", ")) {
                final LanguageField field = new LanguageField(language);
                field.normalize();
                languages.add(field);
            }
            record.setLanguages(languages);
            final List<ContributorField> contributors = Lists.newArrayList();
            for (final Object author : (List<?>) row.get("authors")) {
                final ContributorField field = new ContributorField((String) author);
                field.setName((String) author);
                contributors.add(field);
            }
            record.setContributors(contributors);
            return record;
        }

    }

}
