package nl.uu.edpop.explorer.internal;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Properties;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Util {

    private static final Logger LOGGER = LoggerFactory.getLogger(Util.class);

    /**
     * Returns the version of a module, as recorded by Maven in the packaged
     * {@code pom.properties}.
     * 
     * @param groupId
     *            the group ID
     * @param artifactId
     *            the artifact ID
     * @param defaultValue
     *            the value returned when the module is not packaged, e.g. in a development tree
     * @return the version
     */
    public static String getVersion(final String groupId, final String artifactId,
            final String defaultValue) {
        final String resource = "META-INF/maven/" + groupId + "/" + artifactId
                + "/pom.properties";
        final URL url = Util.class.getClassLoader().getResource(resource);
        if (url == null) {
            return defaultValue;
        }
        final Properties properties = new Properties();
        try {
            final InputStream stream = url.openStream();
            try {
                properties.load(stream);
            } finally {
                stream.close();
            }
        } catch (final IOException ex) {
            LOGGER.debug("Could not read " + resource, ex);
            return defaultValue;
        }
        final String version = properties.getProperty("version");
        return version == null ? defaultValue : version.trim();
    }

    @Nullable
    public static <T> T closeQuietly(@Nullable final T object) {
        if (object instanceof AutoCloseable) {
            try {
                ((AutoCloseable) object).close();
            } catch (final Exception ex) {
                LOGGER.warn("Ignoring failure closing {}: {}", object.getClass().getSimpleName(),
                        ex.getMessage());
            }
        }
        return object;
    }

    private Util() {
    }

}
