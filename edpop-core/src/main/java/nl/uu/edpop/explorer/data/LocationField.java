package nl.uu.edpop.explorer.data;

import javax.annotation.Nullable;

import org.openrdf.model.URI;

import nl.uu.edpop.explorer.vocabulary.EDPOPREC;

/**
 * A field naming a place. The location type is {@link EDPOPREC#CITY} or {@link EDPOPREC#COUNTRY}
 * when known.
 */
public class LocationField extends Field {

    public static final String LOCATION_TYPE = "location_type";

    public LocationField(final String originalText) throws FieldException {
        super(EDPOPREC.LOCATION_FIELD, originalText);
        addSubfield(LOCATION_TYPE, EDPOPREC.LOCATION_TYPE, Datatype.URIREF);
    }

    @Nullable
    public URI getLocationType() {
        return (URI) get(LOCATION_TYPE);
    }

    public void setLocationType(@Nullable final URI locationType) {
        set(LOCATION_TYPE, locationType);
    }

}
