package nl.uu.edpop.explorer.data;

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import org.openrdf.model.URI;
import org.openrdf.model.Value;

/**
 * A datatype of field subfields, mapping Java values to RDF values.
 * <p>
 * Datatypes are identified by name; subfields refer to them by name and the datatype is resolved
 * with {@link #forName(String)} when the field is serialized. Four datatypes are defined:
 * </p>
 * <ul>
 * <li>{@code string}: {@link String} values, rendered as plain literals;</li>
 * <li>{@code boolean}: {@link Boolean} values, rendered as {@code xsd:boolean} literals;</li>
 * <li>{@code edtf}: {@link EDTFDate} values, rendered as literals typed {@link #EDTF_DATATYPE};</li>
 * <li>{@code uriref}: {@link URI} values, rendered as themselves.</li>
 * </ul>
 */
public final class Datatype {

    public static final String STRING = "string";

    public static final String BOOLEAN = "boolean";

    public static final String EDTF = "edtf";

    public static final String URIREF = "uriref";

    /** Datatype of EDTF literals: {@code http://id.loc.gov/datatypes/edtf/EDTF}. */
    public static final URI EDTF_DATATYPE = Data.getValueFactory().createURI(
            "http://id.loc.gov/datatypes/edtf/EDTF");

    private static final Map<String, Datatype> DATATYPES = ImmutableMap.of( //
            STRING, new Datatype(STRING, String.class, new Function<Object, Value>() {

                @Override
                public Value apply(final Object input) {
                    return Data.getValueFactory().createLiteral((String) input);
                }

            }), //
            BOOLEAN, new Datatype(BOOLEAN, Boolean.class, new Function<Object, Value>() {

                @Override
                public Value apply(final Object input) {
                    return Data.getValueFactory().createLiteral(((Boolean) input).booleanValue());
                }

            }), //
            EDTF, new Datatype(EDTF, EDTFDate.class, new Function<Object, Value>() {

                @Override
                public Value apply(final Object input) {
                    return Data.getValueFactory().createLiteral(input.toString(), EDTF_DATATYPE);
                }

            }), //
            URIREF, new Datatype(URIREF, URI.class, new Function<Object, Value>() {

                @Override
                public Value apply(final Object input) {
                    return (URI) input;
                }

            }));

    private final String name;

    private final Class<?> inputType;

    private final Function<Object, Value> converter;

    private Datatype(final String name, final Class<?> inputType,
            final Function<Object, Value> converter) {
        this.name = name;
        this.inputType = inputType;
        this.converter = converter;
    }

    /**
     * Returns the datatype with the name specified.
     * 
     * @param name
     *            the datatype name
     * @return the datatype, or null if no datatype has that name
     */
    @Nullable
    public static Datatype forName(@Nullable final String name) {
        return name == null ? null : DATATYPES.get(name);
    }

    public String getName() {
        return this.name;
    }

    public Class<?> getInputType() {
        return this.inputType;
    }

    /**
     * Checks whether the value supplied can be converted by this datatype.
     * 
     * @param value
     *            the value to check
     * @return true if the value is an instance of the input type of this datatype
     */
    public boolean accepts(@Nullable final Object value) {
        return this.inputType.isInstance(value);
    }

    /**
     * Converts a value to the corresponding RDF value.
     * 
     * @param value
     *            the value to convert, accepted by this datatype
     * @return the RDF value
     * @throws IllegalArgumentException
     *             if the value is not accepted by this datatype
     */
    public Value convert(final Object value) throws IllegalArgumentException {
        Preconditions.checkArgument(accepts(value), "%s is not a valid %s value", value,
                this.name);
        return this.converter.apply(value);
    }

    @Override
    public String toString() {
        return this.name;
    }

}
