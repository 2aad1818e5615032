package nl.uu.edpop.explorer.reader.http;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.Charset;

import javax.annotation.Nullable;

import com.google.common.base.Charsets;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.io.ByteStreams;
import com.google.common.io.CharStreams;
import com.google.common.io.Files;

import org.apache.http.HttpEntity;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpResponse;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.entity.ContentType;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nl.uu.edpop.explorer.ReaderException;
import nl.uu.edpop.explorer.internal.Settings;
import nl.uu.edpop.explorer.internal.Util;

/**
 * HTTP access shared by the readers of web catalogs.
 * <p>
 * Requests are executed with a pooled Apache HttpClient configured with the timeout and user
 * agent of the {@link Settings} supplied. Failures (I/O errors, responses with status 400 or
 * higher, bodies that cannot be parsed) are reported as {@link ReaderException}s carrying the
 * original message.
 * </p>
 */
public final class HttpTransport implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpTransport.class);

    private static final int DEFAULT_MAX_CONNECTIONS = 4;

    @Nullable
    private static HttpTransport defaultInstance;

    private final PoolingHttpClientConnectionManager connectionManager;

    private final CloseableHttpClient client;

    public HttpTransport(final Settings settings) {
        Preconditions.checkNotNull(settings);
        final int timeout = settings.getHttpTimeout();
        this.connectionManager = new PoolingHttpClientConnectionManager();
        this.connectionManager.setMaxTotal(DEFAULT_MAX_CONNECTIONS);
        this.connectionManager.setDefaultMaxPerRoute(DEFAULT_MAX_CONNECTIONS);
        this.connectionManager.setValidateAfterInactivity(1000); // validate after 1s idle
        final RequestConfig requestConfig = RequestConfig.custom() //
                .setExpectContinueEnabled(false) //
                .setRedirectsEnabled(true) //
                .setConnectionRequestTimeout(timeout) //
                .setConnectTimeout(timeout) //
                .setSocketTimeout(timeout) //
                .build();
        this.client = HttpClients.custom() //
                .setConnectionManager(this.connectionManager) //
                .setDefaultRequestConfig(requestConfig) //
                .setUserAgent(settings.getHttpUserAgent()) //
                .build();
    }

    /**
     * Returns a shared transport configured with the default settings.
     * 
     * @return the shared transport
     */
    public static synchronized HttpTransport getDefault() {
        if (defaultInstance == null) {
            defaultInstance = new HttpTransport(Settings.getDefault());
        }
        return defaultInstance;
    }

    /**
     * Performs a GET request, returning the response body as a string.
     * 
     * @param uri
     *            the URI to retrieve
     * @param accept
     *            the value of the Accept header, null to omit it
     * @return the body, decoded with the charset of the response (UTF-8 if not specified)
     * @throws ReaderException
     *             if the request fails
     */
    public String getText(final URI uri, @Nullable final String accept) throws ReaderException {
        return get(uri, accept, new BodyParser<String>() {

            @Override
            public String parse(final InputStream stream, final Charset charset)
                    throws IOException {
                return CharStreams.toString(new InputStreamReader(stream, charset));
            }

        });
    }

    /**
     * Performs a GET request, handing the response body to the parser supplied.
     * 
     * @param uri
     *            the URI to retrieve
     * @param accept
     *            the value of the Accept header, null to omit it
     * @param parser
     *            the parser of the body
     * @param <T>
     *            the type of the parsed body
     * @return the parsed body
     * @throws ReaderException
     *             if the request fails or the parser throws an exception
     */
    public <T> T get(final URI uri, @Nullable final String accept, final BodyParser<T> parser)
            throws ReaderException {
        Preconditions.checkNotNull(uri);
        Preconditions.checkNotNull(parser);
        final HttpGet request = new HttpGet(uri);
        if (accept != null) {
            request.setHeader(HttpHeaders.ACCEPT, accept);
        }
        LOGGER.debug("GET {}", uri);
        final long ts = System.currentTimeMillis();
        CloseableHttpResponse response = null;
        try {
            response = this.client.execute(request);
            checkStatus(uri, response);
            final HttpEntity entity = response.getEntity();
            if (entity == null) {
                throw new ReaderException("Empty response from " + uri);
            }
            final ContentType contentType = ContentType.getOrDefault(entity);
            final Charset charset = MoreObjects.firstNonNull(contentType.getCharset(),
                    Charsets.UTF_8);
            final InputStream stream = entity.getContent();
            try {
                final T result = parser.parse(stream, charset);
                LOGGER.debug("GET {} completed in {} ms", uri, System.currentTimeMillis() - ts);
                return result;
            } finally {
                stream.close();
            }
        } catch (final ReaderException ex) {
            throw ex;
        } catch (final IOException ex) {
            LOGGER.warn("GET {} failed: {}", uri, ex.getMessage());
            throw new ReaderException("Could not retrieve " + uri + ": " + ex.getMessage(), ex);
        } catch (final Exception ex) {
            LOGGER.warn("Malformed response from {}: {}", uri, ex.getMessage());
            throw new ReaderException("Malformed response from " + uri + ": "
                    + ex.getMessage(), ex);
        } finally {
            Util.closeQuietly(response);
        }
    }

    /**
     * Downloads the resource at the URI specified to a file. The file is written only if the
     * download completes.
     * 
     * @param uri
     *            the URI to retrieve
     * @param file
     *            the destination file; missing parent directories are created
     * @throws ReaderException
     *             if the download or writing the file fails
     */
    public void download(final URI uri, final File file) throws ReaderException {
        Preconditions.checkNotNull(file);
        final File temp = new File(file.getPath() + ".part");
        boolean completed = false;
        try {
            get(uri, null, new BodyParser<Void>() {

                @Override
                public Void parse(final InputStream stream, final Charset charset)
                        throws IOException {
                    Files.createParentDirs(temp);
                    final OutputStream out = Files.asByteSink(temp).openBufferedStream();
                    try {
                        ByteStreams.copy(stream, out);
                    } finally {
                        out.close();
                    }
                    return null;
                }

            });
            Files.move(temp, file);
            completed = true;
        } catch (final IOException ex) {
            throw new ReaderException("Error writing file " + file + ": " + ex.getMessage(), ex);
        } finally {
            if (!completed && temp.exists() && !temp.delete()) {
                LOGGER.warn("Could not delete partial download {}", temp);
            }
        }
        LOGGER.info("Downloaded {} to {}", uri, file);
    }

    private static void checkStatus(final URI uri, final HttpResponse response)
            throws ReaderException {
        final int status = response.getStatusLine().getStatusCode();
        if (status >= 400) {
            LOGGER.warn("GET {} failed with status {}", uri, response.getStatusLine());
            throw new ReaderException("Server returned error " + status + " ("
                    + response.getStatusLine().getReasonPhrase() + ") for " + uri);
        }
    }

    @Override
    public void close() {
        try {
            this.client.close();
        } catch (final IOException ex) {
            LOGGER.error("Failed to close HTTP client", ex);
        } finally {
            this.connectionManager.shutdown();
        }
    }

    /**
     * Parser of response bodies.
     * 
     * @param <T>
     *            the type of the parsed body
     */
    public interface BodyParser<T> {

        T parse(InputStream stream, Charset charset) throws Exception;

    }

}
