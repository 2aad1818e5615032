package nl.uu.edpop.explorer.data;

import java.util.List;

import javax.annotation.Nullable;

import nl.uu.edpop.explorer.Catalog;
import nl.uu.edpop.explorer.vocabulary.EDPOPREC;

/**
 * A record describing a printed work (a book, pamphlet, almanac, etc.).
 */
public class BibliographicalRecord extends Record {

    public static final String TITLE = "title";

    public static final String ALTERNATIVE_TITLE = "alternative_title";

    public static final String CONTRIBUTORS = "contributors";

    public static final String PUBLISHER_OR_PRINTER = "publisher_or_printer";

    public static final String PLACE_OF_PUBLICATION = "place_of_publication";

    public static final String DATING = "dating";

    public static final String LANGUAGES = "languages";

    public static final String EXTENT = "extent";

    public static final String SIZE = "size";

    public static final String PHYSICAL_DESCRIPTION = "physical_description";

    public static final String BOOKSELLER = "bookseller";

    public static final String LOCATION_OF_PRINTING = "location_of_printing";

    public static final String FINGERPRINT = "fingerprint";

    public static final String COLLATION_FORMULA = "collation_formula";

    public static final String GENRES = "genres";

    public static final String HOLDINGS = "holdings";

    public BibliographicalRecord(final Catalog catalog) {
        super(catalog);
        addField(TITLE, EDPOPREC.TITLE, Field.class);
        addField(ALTERNATIVE_TITLE, EDPOPREC.ALTERNATIVE_TITLE, Field.class);
        addField(CONTRIBUTORS, EDPOPREC.CONTRIBUTOR, ContributorField.class);
        addField(PUBLISHER_OR_PRINTER, EDPOPREC.PUBLISHER_OR_PRINTER, Field.class);
        addField(PLACE_OF_PUBLICATION, EDPOPREC.PLACE_OF_PUBLICATION, LocationField.class);
        addField(DATING, EDPOPREC.DATING, DatingField.class);
        addField(LANGUAGES, EDPOPREC.LANGUAGE, LanguageField.class);
        addField(EXTENT, EDPOPREC.EXTENT, Field.class);
        addField(SIZE, EDPOPREC.SIZE, Field.class);
        addField(PHYSICAL_DESCRIPTION, EDPOPREC.PHYSICAL_DESCRIPTION, Field.class);
        addField(BOOKSELLER, EDPOPREC.BOOKSELLER, Field.class);
        addField(LOCATION_OF_PRINTING, EDPOPREC.LOCATION_OF_PRINTING, LocationField.class);
        addField(FINGERPRINT, EDPOPREC.FINGERPRINT, Field.class);
        addField(COLLATION_FORMULA, EDPOPREC.COLLATION_FORMULA, Field.class);
        addField(GENRES, EDPOPREC.GENRE, Field.class);
        addField(HOLDINGS, EDPOPREC.HOLDINGS, Field.class);
    }

    @Nullable
    public Field getTitle() {
        return getField(TITLE, Field.class);
    }

    public void setTitle(@Nullable final Field title) {
        set(TITLE, title);
    }

    @Nullable
    public Field getAlternativeTitle() {
        return getField(ALTERNATIVE_TITLE, Field.class);
    }

    public void setAlternativeTitle(@Nullable final Field alternativeTitle) {
        set(ALTERNATIVE_TITLE, alternativeTitle);
    }

    public List<ContributorField> getContributors() {
        return getFieldList(CONTRIBUTORS, ContributorField.class);
    }

    public void setContributors(@Nullable final List<? extends ContributorField> contributors) {
        setFieldList(CONTRIBUTORS, contributors);
    }

    @Nullable
    public Field getPublisherOrPrinter() {
        return getField(PUBLISHER_OR_PRINTER, Field.class);
    }

    public void setPublisherOrPrinter(@Nullable final Field publisherOrPrinter) {
        set(PUBLISHER_OR_PRINTER, publisherOrPrinter);
    }

    @Nullable
    public LocationField getPlaceOfPublication() {
        return getField(PLACE_OF_PUBLICATION, LocationField.class);
    }

    public void setPlaceOfPublication(@Nullable final LocationField placeOfPublication) {
        set(PLACE_OF_PUBLICATION, placeOfPublication);
    }

    @Nullable
    public DatingField getDating() {
        return getField(DATING, DatingField.class);
    }

    public void setDating(@Nullable final DatingField dating) {
        set(DATING, dating);
    }

    public List<LanguageField> getLanguages() {
        return getFieldList(LANGUAGES, LanguageField.class);
    }

    public void setLanguages(@Nullable final List<? extends LanguageField> languages) {
        setFieldList(LANGUAGES, languages);
    }

    @Nullable
    public Field getExtent() {
        return getField(EXTENT, Field.class);
    }

    public void setExtent(@Nullable final Field extent) {
        set(EXTENT, extent);
    }

    @Nullable
    public Field getSize() {
        return getField(SIZE, Field.class);
    }

    public void setSize(@Nullable final Field size) {
        set(SIZE, size);
    }

    @Nullable
    public Field getPhysicalDescription() {
        return getField(PHYSICAL_DESCRIPTION, Field.class);
    }

    public void setPhysicalDescription(@Nullable final Field physicalDescription) {
        set(PHYSICAL_DESCRIPTION, physicalDescription);
    }

    @Nullable
    public Field getBookseller() {
        return getField(BOOKSELLER, Field.class);
    }

    public void setBookseller(@Nullable final Field bookseller) {
        set(BOOKSELLER, bookseller);
    }

    @Nullable
    public LocationField getLocationOfPrinting() {
        return getField(LOCATION_OF_PRINTING, LocationField.class);
    }

    public void setLocationOfPrinting(@Nullable final LocationField locationOfPrinting) {
        set(LOCATION_OF_PRINTING, locationOfPrinting);
    }

    @Nullable
    public Field getFingerprint() {
        return getField(FINGERPRINT, Field.class);
    }

    public void setFingerprint(@Nullable final Field fingerprint) {
        set(FINGERPRINT, fingerprint);
    }

    @Nullable
    public Field getCollationFormula() {
        return getField(COLLATION_FORMULA, Field.class);
    }

    public void setCollationFormula(@Nullable final Field collationFormula) {
        set(COLLATION_FORMULA, collationFormula);
    }

    public List<Field> getGenres() {
        return getFieldList(GENRES, Field.class);
    }

    public void setGenres(@Nullable final List<? extends Field> genres) {
        setFieldList(GENRES, genres);
    }

    public List<Field> getHoldings() {
        return getFieldList(HOLDINGS, Field.class);
    }

    public void setHoldings(@Nullable final List<? extends Field> holdings) {
        setFieldList(HOLDINGS, holdings);
    }

    @Override
    public String toString() {
        final Object title = peek(TITLE);
        return title instanceof Field ? ((Field) title).getOriginalText() : super
                .toString();
    }

}
