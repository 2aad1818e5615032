package nl.uu.edpop.explorer.reader.marc21;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nl.uu.edpop.explorer.Catalog;
import nl.uu.edpop.explorer.ReaderException;
import nl.uu.edpop.explorer.data.BibliographicalRecord;
import nl.uu.edpop.explorer.data.ContributorField;
import nl.uu.edpop.explorer.data.DatingField;
import nl.uu.edpop.explorer.data.Field;
import nl.uu.edpop.explorer.data.LanguageField;
import nl.uu.edpop.explorer.data.LocationField;
import nl.uu.edpop.explorer.data.NormalizationResult;
import nl.uu.edpop.explorer.data.Record;
import nl.uu.edpop.explorer.reader.sru.SRUReader;

/**
 * Base class of readers of bibliographical catalogs returning MARCXML records over SRU.
 * <p>
 * Record attributes are filled from the first occurrence of a configurable field/subfield pair
 * (see {@link #setSubfieldMapping(String, String, String)}); the defaults are:
 * </p>
 * <ul>
 * <li>{@code title}: 245a; {@code alternative_title}: 246a;</li>
 * <li>{@code publisher_or_printer}: 264b; {@code place_of_publication}: 264a;</li>
 * <li>{@code dating}: 264c (normalized to EDTF); {@code languages}: every 041a (normalized to
 * ISO 639-3);</li>
 * <li>{@code extent}: 300a; {@code physical_description}: 300b; {@code size}: 300c;</li>
 * <li>{@code fingerprint}: 026e.</li>
 * </ul>
 * <p>
 * Contributors are taken from fields 100 and 700 (name in subfield a, relator term in
 * subfield e). Identifiers, links and holdings depend on the catalog and are provided by
 * subclasses.
 * </p>
 */
public abstract class Marc21BibliographicalReader extends SRUReader<Marc21Data> {

    private static final Logger LOGGER = LoggerFactory
            .getLogger(Marc21BibliographicalReader.class);

    private final Map<String, String[]> mappings;

    protected Marc21BibliographicalReader(final Catalog catalog, final String sruURL,
            final String sruVersion) {
        super(catalog, sruURL, sruVersion);
        this.mappings = Maps.newLinkedHashMap();
        setSubfieldMapping(BibliographicalRecord.TITLE, "245", "a");
        setSubfieldMapping(BibliographicalRecord.ALTERNATIVE_TITLE, "246", "a");
        setSubfieldMapping(BibliographicalRecord.PUBLISHER_OR_PRINTER, "264", "b");
        setSubfieldMapping(BibliographicalRecord.PLACE_OF_PUBLICATION, "264", "a");
        setSubfieldMapping(BibliographicalRecord.DATING, "264", "c");
        setSubfieldMapping(BibliographicalRecord.LANGUAGES, "041", "a");
        setSubfieldMapping(BibliographicalRecord.EXTENT, "300", "a");
        setSubfieldMapping(BibliographicalRecord.PHYSICAL_DESCRIPTION, "300", "b");
        setSubfieldMapping(BibliographicalRecord.SIZE, "300", "c");
        setSubfieldMapping(BibliographicalRecord.FINGERPRINT, "026", "e");
    }

    /**
     * Changes the field/subfield pair an attribute is read from. Catalogs that store, e.g., the
     * imprint in field 260 instead of 264 override the defaults in their constructor.
     * 
     * @param attribute
     *            the record attribute, one of the mapped ones
     * @param tag
     *            the MARC21 field tag
     * @param code
     *            the subfield code
     */
    protected final void setSubfieldMapping(final String attribute, final String tag,
            final String code) {
        Preconditions.checkArgument(tag.length() == 3, "Invalid MARC21 tag %s", tag);
        this.mappings.put(attribute, new String[] { tag, Preconditions.checkNotNull(code) });
    }

    @Override
    protected MarcXmlParser newRecordParser() {
        return new MarcXmlParser();
    }

    @Override
    protected Record convertRecord(final Marc21Data data) throws ReaderException {
        final Marc21BibliographicalRecord record = new Marc21BibliographicalRecord(
                getCatalog());
        record.setData(data);
        record.setIdentifier(getIdentifier(data));
        record.setLink(getLink(data));

        for (final String attribute : new String[] { BibliographicalRecord.TITLE,
                BibliographicalRecord.ALTERNATIVE_TITLE,
                BibliographicalRecord.PUBLISHER_OR_PRINTER, BibliographicalRecord.EXTENT,
                BibliographicalRecord.PHYSICAL_DESCRIPTION, BibliographicalRecord.SIZE,
                BibliographicalRecord.FINGERPRINT }) {
            final String text = getMappedSubfield(data, attribute);
            if (text != null) {
                record.set(attribute, new Field(text));
            }
        }

        final String place = getMappedSubfield(data, BibliographicalRecord.PLACE_OF_PUBLICATION);
        if (place != null) {
            record.setPlaceOfPublication(new LocationField(place));
        }

        final String dating = getMappedSubfield(data, BibliographicalRecord.DATING);
        if (dating != null) {
            final DatingField field = new DatingField(dating);
            if (field.normalize() == NormalizationResult.FAIL) {
                LOGGER.debug("Could not normalize dating '{}' of {}", dating,
                        record.getIdentifier());
            }
            record.setDating(field);
        }

        final String[] languageMapping = this.mappings.get(BibliographicalRecord.LANGUAGES);
        final List<LanguageField> languages = Lists.newArrayList();
        for (final String language : data.getAllSubfields(languageMapping[0],
                languageMapping[1])) {
            if (!language.isEmpty()) {
                final LanguageField field = new LanguageField(language);
                field.normalize();
                languages.add(field);
            }
        }
        record.setLanguages(languages);

        record.setContributors(getContributors(data));
        record.setHoldings(getHoldings(data));
        return record;
    }

    @Nullable
    private String getMappedSubfield(final Marc21Data data, final String attribute) {
        final String[] mapping = this.mappings.get(attribute);
        final String value = data.getFirstSubfield(mapping[0], mapping[1]);
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * Returns the contributors of a record, read from fields 100 and 700.
     * 
     * @param data
     *            the MARC21 data
     * @return the contributors, possibly empty
     */
    protected List<ContributorField> getContributors(final Marc21Data data) {
        final List<ContributorField> contributors = Lists.newArrayList();
        for (final String tag : new String[] { "100", "700" }) {
            for (final Marc21Field marcField : data.getFields(tag)) {
                final String name = marcField.getSubfield("a");
                if (name == null || name.isEmpty()) {
                    continue;
                }
                final ContributorField field = new ContributorField(name);
                field.setName(name);
                field.setRole(marcField.getSubfield("e"));
                contributors.add(field);
            }
        }
        return contributors;
    }

    /**
     * Returns the holdings of a record. There is no standard place for them, so none are
     * returned by default.
     * 
     * @param data
     *            the MARC21 data
     * @return the holdings, possibly empty
     */
    protected List<Field> getHoldings(final Marc21Data data) {
        return Collections.emptyList();
    }

    /**
     * Returns the identifier of a record within the catalog.
     * 
     * @param data
     *            the MARC21 data
     * @return the identifier, or null if not available
     */
    @Nullable
    protected abstract String getIdentifier(Marc21Data data);

    /**
     * Returns the public URL of a record.
     * 
     * @param data
     *            the MARC21 data
     * @return the URL, or null if not available
     */
    @Nullable
    protected abstract String getLink(Marc21Data data);

}
