package nl.uu.edpop.explorer.reader.sru;

import java.io.InputStream;
import java.io.StringReader;
import java.util.List;

import javax.annotation.Nullable;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * A parsed SRU {@code searchRetrieveResponse}.
 * <p>
 * Parsing is namespace-agnostic, so that both SRU 1.1 and 1.2 responses are accepted. Records
 * packed as XML strings ({@code recordPacking} "string") are unescaped and parsed as well.
 * Diagnostics returned by the server are reported through {@link #getDiagnostic()}.
 * </p>
 * 
 * @param <T>
 *            the type of parsed records
 */
public final class SRUResponse<T> {

    private static final XMLInputFactory FACTORY;

    static {
        FACTORY = XMLInputFactory.newInstance();
        FACTORY.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
        FACTORY.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        FACTORY.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        FACTORY.setProperty(XMLInputFactory.IS_COALESCING, true);
    }

    private final int numberOfRecords;

    private final List<T> records;

    @Nullable
    private final String diagnostic;

    private SRUResponse(final int numberOfRecords, final List<T> records,
            @Nullable final String diagnostic) {
        this.numberOfRecords = numberOfRecords;
        this.records = ImmutableList.copyOf(records);
        this.diagnostic = diagnostic;
    }

    /**
     * Parses an SRU response.
     * 
     * @param stream
     *            the XML response
     * @param parser
     *            the parser of record payloads
     * @param <T>
     *            the type of parsed records
     * @return the parsed response
     * @throws XMLStreamException
     *             if the response is not well-formed XML
     */
    public static <T> SRUResponse<T> parse(final InputStream stream,
            final SRURecordParser<T> parser) throws XMLStreamException {
        Preconditions.checkNotNull(parser);
        final XMLStreamReader reader = FACTORY.createXMLStreamReader(stream);
        try {
            return parse(reader, parser);
        } finally {
            reader.close();
        }
    }

    private static <T> SRUResponse<T> parse(final XMLStreamReader reader,
            final SRURecordParser<T> parser) throws XMLStreamException {
        int numberOfRecords = 0;
        final List<T> records = Lists.newArrayList();
        String diagnosticMessage = null;
        String diagnosticDetails = null;
        boolean inDiagnostics = false;
        while (reader.hasNext()) {
            if (reader.next() != XMLStreamConstants.START_ELEMENT) {
                if (reader.getEventType() == XMLStreamConstants.END_ELEMENT
                        && "diagnostics".equals(reader.getLocalName())) {
                    inDiagnostics = false;
                }
                continue;
            }
            final String name = reader.getLocalName();
            if ("numberOfRecords".equals(name)) {
                final String text = reader.getElementText().trim();
                try {
                    numberOfRecords = Integer.parseInt(text);
                } catch (final NumberFormatException ex) {
                    throw new XMLStreamException("Invalid numberOfRecords: " + text);
                }
            } else if ("recordData".equals(name)) {
                records.add(parseRecordData(reader, parser));
            } else if ("diagnostics".equals(name)) {
                inDiagnostics = true;
            } else if (inDiagnostics && "message".equals(name) && diagnosticMessage == null) {
                diagnosticMessage = reader.getElementText().trim();
            } else if (inDiagnostics && "details".equals(name) && diagnosticDetails == null) {
                diagnosticDetails = reader.getElementText().trim();
            }
        }
        String diagnostic = diagnosticMessage;
        if (diagnosticDetails != null && !diagnosticDetails.isEmpty()) {
            diagnostic = diagnostic == null ? diagnosticDetails : diagnostic + ": "
                    + diagnosticDetails;
        }
        return new SRUResponse<T>(numberOfRecords, records, diagnostic);
    }

    private static <T> T parseRecordData(final XMLStreamReader reader,
            final SRURecordParser<T> parser) throws XMLStreamException {
        parser.init();
        final StringBuilder text = new StringBuilder();
        boolean hasElements = false;
        int depth = 0;
        while (true) {
            final int event = reader.next();
            if (event == XMLStreamConstants.END_ELEMENT && depth == 0) {
                break;
            } else if (event == XMLStreamConstants.START_ELEMENT) {
                ++depth;
                hasElements = true;
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                --depth;
            } else if (event == XMLStreamConstants.END_DOCUMENT) {
                throw new XMLStreamException("Unexpected end of document in recordData");
            } else if (!hasElements && (event == XMLStreamConstants.CHARACTERS
                    || event == XMLStreamConstants.CDATA)) {
                text.append(reader.getText());
            }
            parser.handle(reader);
        }
        final String packed = text.toString().trim();
        if (!hasElements && packed.startsWith("<")) {
            // record packing "string": the payload is escaped XML
            parser.init();
            final XMLStreamReader inner = FACTORY.createXMLStreamReader(new StringReader(packed));
            try {
                while (inner.hasNext()) {
                    inner.next();
                    parser.handle(inner);
                }
            } finally {
                inner.close();
            }
        }
        return parser.result();
    }

    /**
     * Returns the total number of records matching the query.
     * 
     * @return the number of records
     */
    public int getNumberOfRecords() {
        return this.numberOfRecords;
    }

    /**
     * Returns the records in this response, in result order.
     * 
     * @return an immutable list of parsed records
     */
    public List<T> getRecords() {
        return this.records;
    }

    /**
     * Returns the first diagnostic reported by the server.
     * 
     * @return the diagnostic message, or null if the request succeeded
     */
    @Nullable
    public String getDiagnostic() {
        return this.diagnostic;
    }

}
