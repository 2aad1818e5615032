package nl.uu.edpop.explorer.reader.sql;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Range;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nl.uu.edpop.explorer.Catalog;
import nl.uu.edpop.explorer.GetByIdBasedOnQuery;
import nl.uu.edpop.explorer.QueryBasedLookup;
import nl.uu.edpop.explorer.Reader;
import nl.uu.edpop.explorer.ReaderException;
import nl.uu.edpop.explorer.data.Record;
import nl.uu.edpop.explorer.internal.Util;

/**
 * Base class of readers of catalogs distributed as an SQLite database file.
 * <p>
 * All the records matching a query are read at once with the statement built by
 * {@link #buildStatement(SQLQuery)}, i.e., by default, the {@link #getSelectStatement() base
 * select statement} followed by the {@code WHERE} clause of the query. By default every row
 * becomes a record through {@link #convertRow(Map)}; readers joining tables override
 * {@link #readRecords(ResultSet)} instead.
 * </p>
 */
public abstract class SQLReader extends Reader<SQLQuery> implements QueryBasedLookup<SQLQuery> {

    private static final Logger LOGGER = LoggerFactory.getLogger(SQLReader.class);

    private final DatabaseFile databaseFile;

    protected SQLReader(final Catalog catalog, final DatabaseFile databaseFile) {
        super(catalog);
        this.databaseFile = Preconditions.checkNotNull(databaseFile);
    }

    public final DatabaseFile getDatabaseFile() {
        return this.databaseFile;
    }

    @Override
    public Range<Integer> fetchRange(final Range<Integer> range) throws ReaderException {
        final Integer total = getNumberOfResults();
        if (total != null) {
            return truncate(range, total);
        }
        final SQLQuery query = getPreparedQuery();
        if (query == null) {
            throw new ReaderException("First set a query on " + this);
        }
        final List<Record> records = select(query);
        for (int i = 0; i < records.size(); ++i) {
            putRecord(i, records.get(i));
        }
        setNumberOfResults(records.size());
        return Range.closedOpen(0, records.size());
    }

    @Override
    public Record getByID(final String identifier) throws ReaderException {
        return GetByIdBasedOnQuery.getByID(this, identifier);
    }

    /**
     * Returns the statement selecting the rows of the records, without {@code WHERE} clause,
     * e.g., {@code SELECT * FROM books}.
     * 
     * @return the select statement
     */
    protected abstract String getSelectStatement();

    /**
     * Builds the SQL statement evaluating a prepared query.
     * 
     * @param query
     *            the prepared query
     * @return the SQL statement, with placeholders for the query arguments
     */
    protected String buildStatement(final SQLQuery query) {
        final String where = query.getWhereClause();
        return where.isEmpty() ? getSelectStatement() : getSelectStatement() + " " + where;
    }

    /**
     * Converts the rows of a result set to records.
     * 
     * @param resultSet
     *            the result set, positioned before the first row
     * @return the records, in result order
     * @throws SQLException
     *             if reading the result set fails
     * @throws ReaderException
     *             if a row cannot be converted
     */
    protected List<Record> readRecords(final ResultSet resultSet) throws SQLException,
            ReaderException {
        final ResultSetMetaData metadata = resultSet.getMetaData();
        final List<Record> records = Lists.newArrayList();
        while (resultSet.next()) {
            final Map<String, Object> row = Maps.newLinkedHashMap();
            for (int i = 1; i <= metadata.getColumnCount(); ++i) {
                row.put(metadata.getColumnLabel(i), resultSet.getObject(i));
            }
            records.add(convertRow(row));
        }
        return records;
    }

    /**
     * Converts a row to a record.
     * 
     * @param row
     *            the row, as a map from column labels to values
     * @return the record
     * @throws ReaderException
     *             if the row cannot be converted
     */
    protected abstract Record convertRow(Map<String, Object> row) throws ReaderException;

    private List<Record> select(final SQLQuery query) throws ReaderException {
        final File file = this.databaseFile.prepare();
        final String sql = buildStatement(query);
        Connection connection = null;
        PreparedStatement statement = null;
        ResultSet resultSet = null;
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + file.getAbsolutePath());
            statement = connection.prepareStatement(sql);
            final List<Object> arguments = query.getArguments();
            for (int i = 0; i < arguments.size(); ++i) {
                statement.setObject(i + 1, arguments.get(i));
            }
            resultSet = statement.executeQuery();
            final List<Record> records = readRecords(resultSet);
            LOGGER.debug("{}: {} records read from {} with {}", this, records.size(), file,
                    query);
            return records;
        } catch (final SQLException ex) {
            LOGGER.warn("Query '{}' failed on {}: {}", sql, file, ex.getMessage());
            throw new ReaderException("Error querying database " + file + ": "
                    + ex.getMessage(), ex);
        } finally {
            Util.closeQuietly(resultSet);
            Util.closeQuietly(statement);
            Util.closeQuietly(connection);
        }
    }

}
