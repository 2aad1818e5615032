package nl.uu.edpop.explorer.data;

import java.util.List;

import javax.annotation.Nullable;

import nl.uu.edpop.explorer.Catalog;
import nl.uu.edpop.explorer.vocabulary.EDPOPREC;

/**
 * A record describing a person, such as a printer or bookseller.
 */
public class BiographicalRecord extends Record {

    public static final String NAME = "name";

    public static final String VARIANT_NAMES = "variant_names";

    public static final String PLACE_OF_BIRTH = "place_of_birth";

    public static final String PLACE_OF_DEATH = "place_of_death";

    public static final String PLACES_OF_ACTIVITY = "places_of_activity";

    public static final String TIMESPAN = "timespan";

    public static final String ACTIVITY_TIMESPAN = "activity_timespan";

    public static final String ACTIVITIES = "activities";

    public static final String GENDER = "gender";

    public BiographicalRecord(final Catalog catalog) {
        super(catalog);
        addField(NAME, EDPOPREC.NAME, Field.class);
        addField(VARIANT_NAMES, EDPOPREC.VARIANT_NAME, Field.class);
        addField(PLACE_OF_BIRTH, EDPOPREC.PLACE_OF_BIRTH, LocationField.class);
        addField(PLACE_OF_DEATH, EDPOPREC.PLACE_OF_DEATH, LocationField.class);
        addField(PLACES_OF_ACTIVITY, EDPOPREC.PLACE_OF_ACTIVITY, LocationField.class);
        addField(TIMESPAN, EDPOPREC.TIMESPAN, DatingField.class);
        addField(ACTIVITY_TIMESPAN, EDPOPREC.ACTIVITY_TIMESPAN, DatingField.class);
        addField(ACTIVITIES, EDPOPREC.ACTIVITY, Field.class);
        addField(GENDER, EDPOPREC.GENDER, Field.class);
    }

    @Nullable
    public Field getName() {
        return getField(NAME, Field.class);
    }

    public void setName(@Nullable final Field name) {
        set(NAME, name);
    }

    public List<Field> getVariantNames() {
        return getFieldList(VARIANT_NAMES, Field.class);
    }

    public void setVariantNames(@Nullable final List<? extends Field> variantNames) {
        setFieldList(VARIANT_NAMES, variantNames);
    }

    @Nullable
    public LocationField getPlaceOfBirth() {
        return getField(PLACE_OF_BIRTH, LocationField.class);
    }

    public void setPlaceOfBirth(@Nullable final LocationField placeOfBirth) {
        set(PLACE_OF_BIRTH, placeOfBirth);
    }

    @Nullable
    public LocationField getPlaceOfDeath() {
        return getField(PLACE_OF_DEATH, LocationField.class);
    }

    public void setPlaceOfDeath(@Nullable final LocationField placeOfDeath) {
        set(PLACE_OF_DEATH, placeOfDeath);
    }

    public List<LocationField> getPlacesOfActivity() {
        return getFieldList(PLACES_OF_ACTIVITY, LocationField.class);
    }

    public void setPlacesOfActivity(@Nullable final List<? extends LocationField> placesOfActivity) {
        setFieldList(PLACES_OF_ACTIVITY, placesOfActivity);
    }

    @Nullable
    public DatingField getTimespan() {
        return getField(TIMESPAN, DatingField.class);
    }

    public void setTimespan(@Nullable final DatingField timespan) {
        set(TIMESPAN, timespan);
    }

    @Nullable
    public DatingField getActivityTimespan() {
        return getField(ACTIVITY_TIMESPAN, DatingField.class);
    }

    public void setActivityTimespan(@Nullable final DatingField activityTimespan) {
        set(ACTIVITY_TIMESPAN, activityTimespan);
    }

    public List<Field> getActivities() {
        return getFieldList(ACTIVITIES, Field.class);
    }

    public void setActivities(@Nullable final List<? extends Field> activities) {
        setFieldList(ACTIVITIES, activities);
    }

    @Nullable
    public Field getGender() {
        return getField(GENDER, Field.class);
    }

    public void setGender(@Nullable final Field gender) {
        set(GENDER, gender);
    }

    @Override
    public String toString() {
        final Object name = peek(NAME);
        return name instanceof Field ? ((Field) name).getOriginalText() : super
                .toString();
    }

}
