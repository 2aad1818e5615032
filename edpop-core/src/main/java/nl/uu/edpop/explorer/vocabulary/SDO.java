package nl.uu.edpop.explorer.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.URI;
import org.openrdf.model.impl.NamespaceImpl;
import org.openrdf.model.impl.ValueFactoryImpl;

/**
 * Constants for the subset of the schema.org vocabulary used to describe catalogs.
 * 
 * @see <a href="https://schema.org/">vocabulary specification</a>
 */
public final class SDO {

    /** Recommended prefix for the vocabulary namespace: "schema". */
    public static final String PREFIX = "schema";

    /** Vocabulary namespace: "https://schema.org/". */
    public static final String NAMESPACE = "https://schema.org/";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    // PROPERTIES

    /** Property schema:name. */
    public static final URI NAME = createURI("name");

    /** Property schema:description. */
    public static final URI DESCRIPTION = createURI("description");

    /** Property schema:identifier. */
    public static final URI IDENTIFIER = createURI("identifier");

    // HELPER METHODS

    private static URI createURI(final String localName) {
        return ValueFactoryImpl.getInstance().createURI(NAMESPACE, localName);
    }

    private SDO() {
    }

}
