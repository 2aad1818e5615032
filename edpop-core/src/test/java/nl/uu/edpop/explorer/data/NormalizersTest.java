package nl.uu.edpop.explorer.data;

import org.junit.Assert;
import org.junit.Test;

public class NormalizersTest {

    @Test
    public void testDating() {
        check("1650", "1650");
        check("1650.", "1650");
        check("[1650]", "1650");
        check("1650?", "1650?");
        check("[1650?]", "1650?");
        check("ca. 1650", "1650~");
        check("circa 1650", "1650~");
        check("c. 1650?", "1650%");
        check("c1650", "1650~");
        check("ca1650", "1650~");
        check("c.1650", "1650~");
        check("1650-1660", "1650/1660");
        check("1650 - 1660", "1650/1660");
        check("1650-60", "1650/1660");
        check("165-", "165X");
        check("165-?", "165X");
        check("16--", "16XX");
        check("Anno MDCL, 1650", "1650");
    }

    @Test
    public void testDatingFailure() {
        Assert.assertEquals(NormalizationResult.FAIL, new DatingField("sine anno").normalize());
        Assert.assertEquals(NormalizationResult.FAIL, new DatingField("1650 en 1670").normalize());
        Assert.assertEquals(NormalizationResult.FAIL, new DatingField("1660-1650").normalize());
        Assert.assertEquals(NormalizationResult.NO_DATA, new DatingField("[]").normalize());
    }

    @Test
    public void testDatingIdempotent() {
        final DatingField field = new DatingField("ca. 1650");
        Assert.assertEquals(NormalizationResult.SUCCESS, field.normalize());
        Assert.assertEquals(NormalizationResult.SUCCESS, field.normalize());
        Assert.assertEquals("1650~", field.getEDTF().toString());
    }

    @Test
    public void testLanguage() {
        checkLanguage("Dutch", "nld");
        checkLanguage("dutch ", "nld");
        checkLanguage("nl", "nld");
        checkLanguage("nld", "nld");
        checkLanguage("dut", "nld");
        checkLanguage("ger", "deu");
        checkLanguage("fre", "fra");
        checkLanguage("Latin", "lat");
        checkLanguage("la", "lat");
    }

    @Test
    public void testHistoricalLanguage() {
        checkLanguage("grc", "grc");
        checkLanguage("dum", "dum");
        checkLanguage("frm", "frm");
        checkLanguage("enm", "enm");
        checkLanguage("gmh", "gmh");
        checkLanguage("Middle Dutch", "dum");
        checkLanguage("Ancient Greek (to 1453)", "grc");
        checkLanguage("mul", "mul");
        final LanguageField field = new LanguageField("dum");
        field.normalize();
        Assert.assertEquals("Middle Dutch (ca. 1050-1350)", field.getSummaryText());
    }

    private static void check(final String text, final String expected) {
        final DatingField field = new DatingField(text);
        Assert.assertEquals(text, NormalizationResult.SUCCESS, field.normalize());
        Assert.assertEquals(text, expected, field.getEDTF().toString());
    }

    private static void checkLanguage(final String text, final String expected) {
        final LanguageField field = new LanguageField(text);
        Assert.assertEquals(text, NormalizationResult.SUCCESS, field.normalize());
        Assert.assertEquals(text, expected, field.getLanguageCode());
    }

}
