package nl.uu.edpop.explorer.reader.sru;

import javax.xml.stream.XMLStreamReader;

/**
 * Parser of the payload of an SRU record ({@code recordData} element).
 * <p>
 * For each record, {@link #init()} is called first, then {@link #handle(XMLStreamReader)} for
 * every event inside {@code recordData} (the element itself excluded) and finally
 * {@link #result()}. A parser instance can be reused for the following records.
 * </p>
 * 
 * @param <T>
 *            the type of parsed records
 */
public interface SRURecordParser<T> {

    void init();

    void handle(XMLStreamReader stream);

    T result();

}
