package nl.uu.edpop.explorer.reader.marc21;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;

import nl.uu.edpop.explorer.Catalog;
import nl.uu.edpop.explorer.data.BibliographicalRecord;

/**
 * A bibliographical record whose raw data is a {@link Marc21Data} instance.
 */
public class Marc21BibliographicalRecord extends BibliographicalRecord {

    public Marc21BibliographicalRecord(final Catalog catalog) {
        super(catalog);
    }

    @Nullable
    public Marc21Data getMarc21Data() {
        final Object data = getData();
        return data instanceof Marc21Data ? (Marc21Data) data : null;
    }

    /**
     * Returns a human-readable rendering of the MARC21 data fields, one per line.
     * 
     * @return the rendering, or {@code (no data)}
     */
    public String showRecord() {
        final Marc21Data data = getMarc21Data();
        if (data == null) {
            return "(no data)";
        }
        return Joiner.on('\n').join(data.getFields());
    }

}
