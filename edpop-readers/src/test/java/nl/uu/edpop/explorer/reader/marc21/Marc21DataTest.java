package nl.uu.edpop.explorer.reader.marc21;

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;

import org.junit.Assert;
import org.junit.Test;

public class Marc21DataTest {

    private static Marc21Field field(final String tag, final String... subfields) {
        final ListMultimap<String, String> map = LinkedListMultimap.create();
        for (int i = 0; i < subfields.length; i += 2) {
            map.put(subfields[i], subfields[i + 1]);
        }
        return new Marc21Field(tag, " ", "4", map);
    }

    private static final Marc21Data DATA = new Marc21Data(null, ImmutableMap.of("001", "42"),
            ImmutableList.of(field("245", "a", "Titel", "b", "ondertitel"),
                    field("650", "a", "Boekhandel", "a", "Drukkers"),
                    field("650", "x", "Geschiedenis"), field("650", "a", "Uitgevers"),
                    field("999", "z", "lokaal")));

    @Test
    public void testFirstField() {
        Assert.assertEquals("Titel", DATA.getFirstField("245").getSubfield("a"));
        Assert.assertNull(DATA.getFirstField("100"));
        Assert.assertEquals("Titel", DATA.getFirstSubfield("245", "a"));
        Assert.assertNull(DATA.getFirstSubfield("245", "c"));
        Assert.assertNull(DATA.getFirstSubfield("100", "a"));
        Assert.assertEquals("Titel ondertitel", DATA.getFirstSubfield("245", "a", "b"));
        Assert.assertEquals("Titel ", DATA.getFirstSubfield("245", "a", "c"));
        Assert.assertEquals("42", DATA.getControlField("001"));
    }

    @Test
    public void testRepeatedFields() {
        Assert.assertEquals(3, DATA.getFields("650").size());
        Assert.assertTrue(DATA.getFields("100").isEmpty());
        Assert.assertEquals(ImmutableList.of("Boekhandel", "Uitgevers"),
                DATA.getAllSubfields("650", "a"));
        Assert.assertEquals(ImmutableList.of("Boekhandel", "Drukkers"), DATA.getFirstField("650")
                .getSubfields().get("a"));
    }

    @Test
    public void testToString() {
        Assert.assertEquals("650 (Subject Added Entry - Topical Term): # 4 $a Boekhandel  "
                + "$a Drukkers", DATA.getFields("650").get(0).toString());
        Assert.assertEquals("999: # 4 $z lokaal", DATA.getFirstField("999").toString());
        Assert.assertEquals("Title Statement", DATA.getFirstField("245").getDescription());
        Assert.assertEquals("Publication, Distribution, etc. (Imprint)",
                field("260").getDescription());
    }

    @Test
    public void testToMap() {
        final Map<String, Object> map = DATA.toMap();
        Assert.assertFalse(map.containsKey("leader"));
        Assert.assertEquals(ImmutableMap.of("001", "42"), map.get("controlfields"));
        final Map<?, ?> first = (Map<?, ?>) ((List<?>) map.get("datafields")).get(0);
        Assert.assertEquals("245", first.get("tag"));
        Assert.assertEquals(" ", first.get("ind1"));
        Assert.assertEquals(ImmutableList.of(ImmutableMap.of("code", "a", "text", "Titel"),
                ImmutableMap.of("code", "b", "text", "ondertitel")), first.get("subfields"));
    }

}
