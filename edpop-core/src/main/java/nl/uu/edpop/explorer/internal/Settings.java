package nl.uu.edpop.explorer.internal;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Properties;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Library-wide settings.
 * <p>
 * Default settings are read from the optional classpath resource
 * {@code edpop-explorer.properties}; each property can be overridden by a Java system property
 * with the same name. Custom instances are created with {@link #builder()}.
 * </p>
 */
public final class Settings {

    public static final String PROPERTY_DATA_DIR = "edpop.dataDir";

    public static final String PROPERTY_HTTP_TIMEOUT = "edpop.http.timeout";

    public static final String PROPERTY_HTTP_USER_AGENT = "edpop.http.userAgent";

    public static final String PROPERTY_RECORDS_PER_PAGE = "edpop.recordsPerPage";

    private static final Logger LOGGER = LoggerFactory.getLogger(Settings.class);

    private static final String RESOURCE_NAME = "edpop-explorer.properties";

    private static final int DEFAULT_HTTP_TIMEOUT = 30000; // 30 sec

    private static final int DEFAULT_RECORDS_PER_PAGE = 10;

    @Nullable
    private static Settings defaultSettings;

    private final File dataDir;

    private final int httpTimeout;

    private final String httpUserAgent;

    private final int recordsPerPage;

    private Settings(final Builder builder) {
        this.dataDir = MoreObjects.firstNonNull(builder.dataDir, new File(
                System.getProperty("user.home"), ".local/share/edpop-explorer"));
        this.httpTimeout = MoreObjects.firstNonNull(builder.httpTimeout, DEFAULT_HTTP_TIMEOUT);
        this.httpUserAgent = MoreObjects.firstNonNull(builder.httpUserAgent, "edpop-explorer/"
                + Util.getVersion("nl.uu.edpop", "edpop-core", "devel"));
        this.recordsPerPage = MoreObjects.firstNonNull(builder.recordsPerPage,
                DEFAULT_RECORDS_PER_PAGE);
        Preconditions.checkArgument(this.httpTimeout >= 0, "Invalid HTTP timeout %s",
                this.httpTimeout);
        Preconditions.checkArgument(this.recordsPerPage > 0, "Invalid records per page %s",
                this.recordsPerPage);
    }

    /**
     * Returns the default settings, loading them on first access.
     * 
     * @return the default settings
     */
    public static synchronized Settings getDefault() {
        if (defaultSettings == null) {
            defaultSettings = load();
        }
        return defaultSettings;
    }

    /**
     * Replaces the default settings.
     * 
     * @param settings
     *            the new default settings, or null to reload them on next access
     */
    public static synchronized void setDefault(@Nullable final Settings settings) {
        defaultSettings = settings;
    }

    private static Settings load() {
        final Properties properties = new Properties();
        final URL url = Settings.class.getClassLoader().getResource(RESOURCE_NAME);
        if (url != null) {
            try {
                final InputStream stream = url.openStream();
                try {
                    properties.load(stream);
                } finally {
                    stream.close();
                }
                LOGGER.debug("Settings loaded from {}", url);
            } catch (final IOException ex) {
                LOGGER.warn("Could not read " + url + ", using defaults", ex);
            }
        }
        properties.putAll(System.getProperties());
        final Builder builder = builder();
        final String dataDir = properties.getProperty(PROPERTY_DATA_DIR);
        if (!Strings.isNullOrEmpty(dataDir)) {
            builder.dataDir(new File(dataDir));
        }
        builder.httpTimeout(parseInt(properties, PROPERTY_HTTP_TIMEOUT));
        builder.httpUserAgent(Strings.emptyToNull(properties
                .getProperty(PROPERTY_HTTP_USER_AGENT)));
        builder.recordsPerPage(parseInt(properties, PROPERTY_RECORDS_PER_PAGE));
        return builder.build();
    }

    @Nullable
    private static Integer parseInt(final Properties properties, final String name) {
        final String value = Strings.emptyToNull(properties.getProperty(name));
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (final NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid value for " + name + ": " + value);
        }
    }

    public File getDataDir() {
        return this.dataDir;
    }

    public int getHttpTimeout() {
        return this.httpTimeout;
    }

    public String getHttpUserAgent() {
        return this.httpUserAgent;
    }

    public int getRecordsPerPage() {
        return this.recordsPerPage;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("dataDir", this.dataDir)
                .add("httpTimeout", this.httpTimeout).add("httpUserAgent", this.httpUserAgent)
                .add("recordsPerPage", this.recordsPerPage).toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        @Nullable
        private File dataDir;

        @Nullable
        private Integer httpTimeout;

        @Nullable
        private String httpUserAgent;

        @Nullable
        private Integer recordsPerPage;

        public Builder dataDir(@Nullable final File dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        public Builder httpTimeout(@Nullable final Integer httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder httpUserAgent(@Nullable final String httpUserAgent) {
            this.httpUserAgent = httpUserAgent;
            return this;
        }

        public Builder recordsPerPage(@Nullable final Integer recordsPerPage) {
            this.recordsPerPage = recordsPerPage;
            return this;
        }

        public Settings build() {
            return new Settings(this);
        }

    }

}
