package nl.uu.edpop.explorer.internal;

import java.io.File;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

public class SettingsTest {

    @After
    public void tearDown() {
        System.clearProperty(Settings.PROPERTY_RECORDS_PER_PAGE);
        System.clearProperty(Settings.PROPERTY_DATA_DIR);
        Settings.setDefault(null);
    }

    @Test
    public void testDefaults() {
        final Settings settings = Settings.builder().build();
        Assert.assertEquals(30000, settings.getHttpTimeout());
        Assert.assertEquals(10, settings.getRecordsPerPage());
        Assert.assertTrue(settings.getHttpUserAgent().startsWith("edpop-explorer/"));
        Assert.assertTrue(settings.getDataDir().getPath().endsWith("edpop-explorer"));
    }

    @Test
    public void testSystemPropertyOverride() {
        System.setProperty(Settings.PROPERTY_RECORDS_PER_PAGE, "25");
        System.setProperty(Settings.PROPERTY_DATA_DIR, "/tmp/edpop-data");
        Settings.setDefault(null);
        final Settings settings = Settings.getDefault();
        Assert.assertEquals(25, settings.getRecordsPerPage());
        Assert.assertEquals(new File("/tmp/edpop-data"), settings.getDataDir());
        Assert.assertSame(settings, Settings.getDefault());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidProperty() {
        System.setProperty(Settings.PROPERTY_RECORDS_PER_PAGE, "many");
        Settings.setDefault(null);
        Settings.getDefault();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidRecordsPerPage() {
        Settings.builder().recordsPerPage(0).build();
    }

}
