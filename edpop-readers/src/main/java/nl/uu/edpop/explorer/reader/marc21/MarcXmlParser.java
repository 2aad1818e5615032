package nl.uu.edpop.explorer.reader.marc21;

import java.util.List;
import java.util.Map;

import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamReader;

import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import nl.uu.edpop.explorer.reader.sru.SRURecordParser;

/**
 * Parser of MARCXML (and MarcXchange) record payloads. Elements are matched on their local name,
 * so that any namespace or prefix is accepted.
 */
public final class MarcXmlParser implements SRURecordParser<Marc21Data> {

    private String leader;

    private Map<String, String> controlFields;

    private List<Marc21Field> fields;

    private String tag;

    private String indicator1;

    private String indicator2;

    private ListMultimap<String, String> subfields;

    private String code;

    private StringBuilder text;

    @Override
    public void init() {
        this.leader = null;
        this.controlFields = Maps.newLinkedHashMap();
        this.fields = Lists.newArrayList();
        this.tag = null;
        this.subfields = null;
        this.code = null;
        this.text = null;
    }

    @Override
    public void handle(final XMLStreamReader stream) {
        final int event = stream.getEventType();
        if (event == XMLStreamConstants.START_ELEMENT) {
            final String name = stream.getLocalName();
            if ("leader".equals(name)) {
                this.text = new StringBuilder();
            } else if ("controlfield".equals(name)) {
                this.tag = stream.getAttributeValue(null, "tag");
                this.text = new StringBuilder();
            } else if ("datafield".equals(name)) {
                this.tag = stream.getAttributeValue(null, "tag");
                this.indicator1 = stream.getAttributeValue(null, "ind1");
                this.indicator2 = stream.getAttributeValue(null, "ind2");
                this.subfields = LinkedListMultimap.create();
            } else if ("subfield".equals(name) && this.subfields != null) {
                this.code = stream.getAttributeValue(null, "code");
                this.text = new StringBuilder();
            }

        } else if (event == XMLStreamConstants.CHARACTERS || event == XMLStreamConstants.CDATA) {
            if (this.text != null) {
                this.text.append(stream.getText());
            }

        } else if (event == XMLStreamConstants.END_ELEMENT) {
            final String name = stream.getLocalName();
            if ("leader".equals(name) && this.text != null) {
                this.leader = this.text.toString();
                this.text = null;
            } else if ("controlfield".equals(name) && this.text != null) {
                if (this.tag != null) {
                    this.controlFields.put(this.tag, this.text.toString());
                }
                this.tag = null;
                this.text = null;
            } else if ("subfield".equals(name) && this.text != null) {
                if (this.code != null) {
                    this.subfields.put(this.code, this.text.toString().trim());
                }
                this.code = null;
                this.text = null;
            } else if ("datafield".equals(name) && this.subfields != null) {
                if (this.tag != null) {
                    this.fields.add(new Marc21Field(this.tag, this.indicator1,
                            this.indicator2, this.subfields));
                }
                this.tag = null;
                this.subfields = null;
            }
        }
    }

    @Override
    public Marc21Data result() {
        return new Marc21Data(this.leader, this.controlFields, this.fields);
    }

}
