package nl.uu.edpop.explorer.reader.sql;

import java.io.File;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import nl.uu.edpop.explorer.ReaderException;
import nl.uu.edpop.explorer.internal.Settings;
import nl.uu.edpop.explorer.reader.TestHttpServer;
import nl.uu.edpop.explorer.reader.http.HttpTransport;

public class DatabaseFileTest {

    private Path dataDir;

    private Settings settings;

    private TestHttpServer server;

    private HttpTransport transport;

    @Before
    public void setUp() throws Throwable {
        this.dataDir = Files.createTempDirectory("edpop-data");
        this.settings = Settings.builder().dataDir(new File(this.dataDir.toFile(), "nested"))
                .httpTimeout(5000).build();
        Settings.setDefault(this.settings);
        this.server = new TestHttpServer(new TestHttpServer.Responder() {

            @Override
            public TestHttpServer.Response respond(final String path,
                    final Map<String, String> parameters) {
                if ("/db.sqlite3".equals(path)) {
                    return new TestHttpServer.Response(200, "application/octet-stream",
                            "database content");
                }
                return new TestHttpServer.Response(404, "text/plain", "not found");
            }

        });
        this.transport = new HttpTransport(this.settings);
    }

    @After
    public void tearDown() throws Throwable {
        this.transport.close();
        this.server.close();
        Settings.setDefault(null);
        MoreFiles.deleteRecursively(this.dataDir, RecursiveDeleteOption.ALLOW_INSECURE);
    }

    @Test
    public void testDownload() throws Throwable {
        final DatabaseFile databaseFile = new DatabaseFile("db.sqlite3", URI.create(this.server
                .getURL("/db.sqlite3")));
        Assert.assertFalse(databaseFile.getFile().exists());
        final File file = databaseFile.prepare(this.transport);
        Assert.assertEquals(new File(this.settings.getDataDir(), "db.sqlite3"), file);
        Assert.assertEquals("database content", new String(Files.readAllBytes(file.toPath()),
                StandardCharsets.UTF_8));
        Assert.assertFalse(new File(file.getPath() + ".part").exists());

        // no second download
        Assert.assertEquals(file, databaseFile.prepare(this.transport));
        Assert.assertEquals(1, this.server.getRequests().size());
    }

    @Test
    public void testDownloadFailure() throws Throwable {
        final DatabaseFile databaseFile = new DatabaseFile("other.sqlite3", URI
                .create(this.server.getURL("/other.sqlite3")));
        try {
            databaseFile.prepare(this.transport);
            Assert.fail();
        } catch (final ReaderException ex) {
            Assert.assertTrue(ex.getMessage().contains("404"));
        }
        Assert.assertFalse(databaseFile.getFile().exists());
    }

    @Test
    public void testNoDownloadURI() throws Throwable {
        final DatabaseFile databaseFile = new DatabaseFile("local.sqlite3", null);
        try {
            databaseFile.prepare(this.transport);
            Assert.fail();
        } catch (final ReaderException ex) {
            Assert.assertTrue(ex.getMessage().contains(this.settings.getDataDir().getPath()));
        }
    }

    @Test
    public void testInvalidFilename() {
        try {
            new DatabaseFile("../db.sqlite3", null);
            Assert.fail();
        } catch (final IllegalArgumentException ex) {
            // expected
        }
    }

}
