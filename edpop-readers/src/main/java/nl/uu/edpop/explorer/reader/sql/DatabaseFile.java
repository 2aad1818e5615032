package nl.uu.edpop.explorer.reader.sql;

import java.io.File;
import java.net.URI;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nl.uu.edpop.explorer.ReaderException;
import nl.uu.edpop.explorer.internal.Settings;
import nl.uu.edpop.explorer.reader.http.HttpTransport;

/**
 * A local database file used by a reader, located in the data directory of the current
 * {@link Settings} and optionally downloaded from a URL the first time it is needed.
 */
public final class DatabaseFile {

    private static final Logger LOGGER = LoggerFactory.getLogger(DatabaseFile.class);

    private final String filename;

    @Nullable
    private final URI downloadURI;

    public DatabaseFile(final String filename, @Nullable final URI downloadURI) {
        Preconditions.checkArgument(!filename.isEmpty() && filename.indexOf('/') < 0
                && filename.indexOf(File.separatorChar) < 0, "Invalid filename %s", filename);
        this.filename = filename;
        this.downloadURI = downloadURI;
    }

    public String getFilename() {
        return this.filename;
    }

    @Nullable
    public URI getDownloadURI() {
        return this.downloadURI;
    }

    public File getFile() {
        return new File(Settings.getDefault().getDataDir(), this.filename);
    }

    /**
     * Makes sure the database file is available, downloading it with the default HTTP transport
     * if missing.
     * 
     * @return the database file
     * @throws ReaderException
     *             if the file is missing and cannot be downloaded
     */
    public File prepare() throws ReaderException {
        return prepare(null);
    }

    /**
     * Makes sure the database file is available, downloading it if missing.
     * 
     * @param transport
     *            the transport to download with, null for the default one
     * @return the database file
     * @throws ReaderException
     *             if the file is missing and cannot be downloaded
     */
    public File prepare(@Nullable final HttpTransport transport) throws ReaderException {
        final File file = getFile();
        if (file.isFile()) {
            return file;
        }
        if (this.downloadURI == null) {
            throw new ReaderException("Database file " + this.filename
                    + " not found; please place it in directory " + file.getParentFile());
        }
        LOGGER.info("Database file {} not found, downloading it from {}", file,
                this.downloadURI);
        (transport != null ? transport : HttpTransport.getDefault()).download(this.downloadURI,
                file);
        return file;
    }

    @Override
    public String toString() {
        return getFile().getPath();
    }

}
