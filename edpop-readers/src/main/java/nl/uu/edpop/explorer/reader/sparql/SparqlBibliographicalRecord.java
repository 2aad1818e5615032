package nl.uu.edpop.explorer.reader.sparql;

import com.google.common.base.Preconditions;

import nl.uu.edpop.explorer.data.BibliographicalRecord;
import nl.uu.edpop.explorer.data.LazyRecord;
import nl.uu.edpop.explorer.data.LazyRecordSupport;
import nl.uu.edpop.explorer.data.RecordException;

/**
 * A lazy bibliographical record whose data is retrieved from a SPARQL endpoint on first access.
 */
public class SparqlBibliographicalRecord extends BibliographicalRecord implements LazyRecord {

    private final String iri;

    private final LazyRecordSupport support;

    public SparqlBibliographicalRecord(final SparqlReader reader, final String iri) {
        super(reader.getCatalog());
        Preconditions.checkNotNull(reader);
        this.iri = Preconditions.checkNotNull(iri);
        this.support = new LazyRecordSupport(this, new LazyRecordSupport.Loader() {

            @Override
            public void load() throws Exception {
                reader.load(SparqlBibliographicalRecord.this, iri);
            }

        });
    }

    public final String getSubjectIRI() {
        return this.iri;
    }

    @Override
    public final boolean isFetched() {
        return this.support.isFetched();
    }

    @Override
    public final void fetch() throws RecordException {
        this.support.fetch();
    }

}
