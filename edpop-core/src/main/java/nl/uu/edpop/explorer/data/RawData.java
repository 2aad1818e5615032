package nl.uu.edpop.explorer.data;

import java.util.Map;

/**
 * Structured raw data of a record, as returned by a catalog, that can be rendered as a map of
 * plain Java values (maps, lists, strings, numbers and booleans).
 */
public interface RawData {

    Map<String, Object> toMap();

}
