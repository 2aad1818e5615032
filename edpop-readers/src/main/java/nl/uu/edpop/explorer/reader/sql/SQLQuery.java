package nl.uu.edpop.explorer.reader.sql;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A prepared query of a {@link SQLReader}: a {@code WHERE} clause with {@code ?} placeholders
 * and the values bound to them. Queries are compared by value.
 */
public final class SQLQuery implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String whereClause;

    private final List<Object> arguments;

    public SQLQuery(final String whereClause, final Object... arguments) {
        this(whereClause, Arrays.asList(arguments));
    }

    public SQLQuery(final String whereClause, final List<?> arguments) {
        this.whereClause = Preconditions.checkNotNull(whereClause).trim();
        for (final Object argument : arguments) {
            Preconditions.checkArgument(argument instanceof String || argument instanceof Number,
                    "Unsupported argument %s", argument);
        }
        this.arguments = ImmutableList.copyOf(arguments);
        int placeholders = 0;
        for (int i = 0; i < this.whereClause.length(); ++i) {
            if (this.whereClause.charAt(i) == '?') {
                ++placeholders;
            }
        }
        Preconditions.checkArgument(placeholders == this.arguments.size(),
                "%s placeholders but %s arguments in %s", placeholders, this.arguments.size(),
                whereClause);
    }

    public String getWhereClause() {
        return this.whereClause;
    }

    public List<Object> getArguments() {
        return this.arguments;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof SQLQuery)) {
            return false;
        }
        final SQLQuery other = (SQLQuery) object;
        return this.whereClause.equals(other.whereClause)
                && this.arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return this.whereClause.hashCode() * 31 + this.arguments.hashCode();
    }

    @Override
    public String toString() {
        return this.whereClause + " " + this.arguments;
    }

}
