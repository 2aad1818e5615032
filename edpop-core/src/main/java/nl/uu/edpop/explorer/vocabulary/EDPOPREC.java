package nl.uu.edpop.explorer.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.URI;
import org.openrdf.model.impl.NamespaceImpl;
import org.openrdf.model.impl.ValueFactoryImpl;

/**
 * Constants for the EDPOP Record Ontology.
 * 
 * @see <a href="https://dhstatic.hum.uu.nl/edpop-records/latest/">vocabulary specification</a>
 */
public final class EDPOPREC {

    /** Recommended prefix for the vocabulary namespace: "edpoprec". */
    public static final String PREFIX = "edpoprec";

    /** Vocabulary namespace: "https://dhstatic.hum.uu.nl/edpop-records/latest/". */
    public static final String NAMESPACE = "https://dhstatic.hum.uu.nl/edpop-records/latest/";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    // CLASSES

    /** Class edpoprec:Catalog. */
    public static final URI CATALOG = createURI("Catalog");

    /** Class edpoprec:BibliographicalCatalog. */
    public static final URI BIBLIOGRAPHICAL_CATALOG = createURI("BibliographicalCatalog");

    /** Class edpoprec:BiographicalCatalog. */
    public static final URI BIOGRAPHICAL_CATALOG = createURI("BiographicalCatalog");

    /** Class edpoprec:Record. */
    public static final URI RECORD = createURI("Record");

    /** Class edpoprec:BibliographicalRecord. */
    public static final URI BIBLIOGRAPHICAL_RECORD = createURI("BibliographicalRecord");

    /** Class edpoprec:BiographicalRecord. */
    public static final URI BIOGRAPHICAL_RECORD = createURI("BiographicalRecord");

    /** Class edpoprec:Field. */
    public static final URI FIELD = createURI("Field");

    /** Class edpoprec:LocationField. */
    public static final URI LOCATION_FIELD = createURI("LocationField");

    /** Class edpoprec:LanguageField. */
    public static final URI LANGUAGE_FIELD = createURI("LanguageField");

    /** Class edpoprec:ContributorField. */
    public static final URI CONTRIBUTOR_FIELD = createURI("ContributorField");

    /** Class edpoprec:DatingField. */
    public static final URI DATING_FIELD = createURI("DatingField");

    // RECORD PROPERTIES

    /** Property edpoprec:fromCatalog. */
    public static final URI FROM_CATALOG = createURI("fromCatalog");

    /** Property edpoprec:identifier. */
    public static final URI IDENTIFIER = createURI("identifier");

    /** Property edpoprec:publicURL. */
    public static final URI PUBLIC_URL = createURI("publicURL");

    /** Property edpoprec:originalData. */
    public static final URI ORIGINAL_DATA = createURI("originalData");

    // BIBLIOGRAPHICAL RECORD PROPERTIES

    /** Property edpoprec:title. */
    public static final URI TITLE = createURI("title");

    /** Property edpoprec:alternativeTitle. */
    public static final URI ALTERNATIVE_TITLE = createURI("alternativeTitle");

    /** Property edpoprec:contributor. */
    public static final URI CONTRIBUTOR = createURI("contributor");

    /** Property edpoprec:publisherOrPrinter. */
    public static final URI PUBLISHER_OR_PRINTER = createURI("publisherOrPrinter");

    /** Property edpoprec:placeOfPublication. */
    public static final URI PLACE_OF_PUBLICATION = createURI("placeOfPublication");

    /** Property edpoprec:dating. */
    public static final URI DATING = createURI("dating");

    /** Property edpoprec:language. */
    public static final URI LANGUAGE = createURI("language");

    /** Property edpoprec:extent. */
    public static final URI EXTENT = createURI("extent");

    /** Property edpoprec:size. */
    public static final URI SIZE = createURI("size");

    /** Property edpoprec:physicalDescription. */
    public static final URI PHYSICAL_DESCRIPTION = createURI("physicalDescription");

    /** Property edpoprec:bookseller. */
    public static final URI BOOKSELLER = createURI("bookseller");

    /** Property edpoprec:locationOfPrinting. */
    public static final URI LOCATION_OF_PRINTING = createURI("locationOfPrinting");

    /** Property edpoprec:fingerprint. */
    public static final URI FINGERPRINT = createURI("fingerprint");

    /** Property edpoprec:collationFormula. */
    public static final URI COLLATION_FORMULA = createURI("collationFormula");

    /** Property edpoprec:genre. */
    public static final URI GENRE = createURI("genre");

    /** Property edpoprec:holdings. */
    public static final URI HOLDINGS = createURI("holdings");

    // BIOGRAPHICAL RECORD PROPERTIES

    /** Property edpoprec:name (also used by contributor fields). */
    public static final URI NAME = createURI("name");

    /** Property edpoprec:variantName. */
    public static final URI VARIANT_NAME = createURI("variantName");

    /** Property edpoprec:placeOfBirth. */
    public static final URI PLACE_OF_BIRTH = createURI("placeOfBirth");

    /** Property edpoprec:placeOfDeath. */
    public static final URI PLACE_OF_DEATH = createURI("placeOfDeath");

    /** Property edpoprec:placeOfActivity. */
    public static final URI PLACE_OF_ACTIVITY = createURI("placeOfActivity");

    /** Property edpoprec:timespan. */
    public static final URI TIMESPAN = createURI("timespan");

    /** Property edpoprec:activityTimespan. */
    public static final URI ACTIVITY_TIMESPAN = createURI("activityTimespan");

    /** Property edpoprec:activity. */
    public static final URI ACTIVITY = createURI("activity");

    /** Property edpoprec:gender. */
    public static final URI GENDER = createURI("gender");

    // FIELD PROPERTIES

    /** Property edpoprec:originalText. */
    public static final URI ORIGINAL_TEXT = createURI("originalText");

    /** Property edpoprec:summaryText. */
    public static final URI SUMMARY_TEXT = createURI("summaryText");

    /** Property edpoprec:normalizedText. */
    public static final URI NORMALIZED_TEXT = createURI("normalizedText");

    /** Property edpoprec:unknown. */
    public static final URI UNKNOWN = createURI("unknown");

    /** Property edpoprec:authorityRecord. */
    public static final URI AUTHORITY_RECORD = createURI("authorityRecord");

    /** Property edpoprec:locationType. */
    public static final URI LOCATION_TYPE = createURI("locationType");

    /** Property edpoprec:languageCode. */
    public static final URI LANGUAGE_CODE = createURI("languageCode");

    /** Property edpoprec:role. */
    public static final URI ROLE = createURI("role");

    /** Property edpoprec:edtf. */
    public static final URI EDTF = createURI("edtf");

    // INDIVIDUALS

    /** Individual edpoprec:city. */
    public static final URI CITY = createURI("city");

    /** Individual edpoprec:country. */
    public static final URI COUNTRY = createURI("country");

    // HELPER METHODS

    private static URI createURI(final String localName) {
        return ValueFactoryImpl.getInstance().createURI(NAMESPACE, localName);
    }

    private EDPOPREC() {
    }

}
