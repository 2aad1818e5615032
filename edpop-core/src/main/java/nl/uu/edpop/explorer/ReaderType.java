package nl.uu.edpop.explorer;

import org.openrdf.model.URI;

import nl.uu.edpop.explorer.vocabulary.EDPOPREC;

/**
 * The kind of records returned by a catalog.
 */
public enum ReaderType {

    BIBLIOGRAPHICAL(EDPOPREC.BIBLIOGRAPHICAL_CATALOG, EDPOPREC.BIBLIOGRAPHICAL_RECORD),

    BIOGRAPHICAL(EDPOPREC.BIOGRAPHICAL_CATALOG, EDPOPREC.BIOGRAPHICAL_RECORD),

    GENERIC(EDPOPREC.CATALOG, EDPOPREC.RECORD);

    private final URI catalogClass;

    private final URI recordClass;

    private ReaderType(final URI catalogClass, final URI recordClass) {
        this.catalogClass = catalogClass;
        this.recordClass = recordClass;
    }

    /**
     * Returns the RDF class of catalogs of this type.
     * 
     * @return the catalog class
     */
    public URI getCatalogClass() {
        return this.catalogClass;
    }

    /**
     * Returns the RDF class of records of catalogs of this type.
     * 
     * @return the record class
     */
    public URI getRecordClass() {
        return this.recordClass;
    }

}
