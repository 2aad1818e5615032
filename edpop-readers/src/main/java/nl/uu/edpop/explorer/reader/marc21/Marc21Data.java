package nl.uu.edpop.explorer.reader.marc21;

import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import nl.uu.edpop.explorer.data.RawData;

/**
 * The content of a MARC21 record: the leader, the control fields (tag to value) and the data
 * fields in document order. Data fields may occur more than once.
 */
public final class Marc21Data implements RawData {

    @Nullable
    private final String leader;

    private final Map<String, String> controlFields;

    private final List<Marc21Field> fields;

    public Marc21Data(@Nullable final String leader, final Map<String, String> controlFields,
            final List<Marc21Field> fields) {
        this.leader = leader;
        this.controlFields = ImmutableMap.copyOf(controlFields);
        this.fields = ImmutableList.copyOf(fields);
    }

    @Nullable
    public String getLeader() {
        return this.leader;
    }

    public Map<String, String> getControlFields() {
        return this.controlFields;
    }

    @Nullable
    public String getControlField(final String tag) {
        return this.controlFields.get(tag);
    }

    public List<Marc21Field> getFields() {
        return this.fields;
    }

    /**
     * Returns the first occurrence of a data field, useful for non-repeatable fields such as
     * 245.
     * 
     * @param tag
     *            the field tag
     * @return the field, or null if it does not occur
     */
    @Nullable
    public Marc21Field getFirstField(final String tag) {
        for (final Marc21Field field : this.fields) {
            if (field.getTag().equals(tag)) {
                return field;
            }
        }
        return null;
    }

    /**
     * Returns a subfield of the first occurrence of a data field. If more subfield codes are
     * given, the values of all of them are joined with a space.
     * 
     * @param tag
     *            the field tag
     * @param codes
     *            one or more subfield codes
     * @return the subfield value, or null if the field does not occur or (for a single code) the
     *         subfield is absent on its first occurrence
     */
    @Nullable
    public String getFirstSubfield(final String tag, final String... codes) {
        Preconditions.checkArgument(codes.length > 0, "No subfield code given");
        final Marc21Field field = getFirstField(tag);
        if (field == null) {
            return null;
        } else if (codes.length == 1) {
            return field.getSubfield(codes[0]);
        }
        final List<String> values = Lists.newArrayList();
        for (final String code : codes) {
            final String value = field.getSubfield(code);
            values.add(value == null ? "" : value);
        }
        return Joiner.on(' ').join(values);
    }

    /**
     * Returns all the occurrences of a data field.
     * 
     * @param tag
     *            the field tag
     * @return the fields, possibly empty
     */
    public List<Marc21Field> getFields(final String tag) {
        final List<Marc21Field> result = Lists.newArrayList();
        for (final Marc21Field field : this.fields) {
            if (field.getTag().equals(tag)) {
                result.add(field);
            }
        }
        return result;
    }

    /**
     * Returns the values of a subfield across all the occurrences of a data field, taking the
     * first occurrence of the subfield within each field.
     * 
     * @param tag
     *            the field tag
     * @param code
     *            the subfield code
     * @return the subfield values, possibly empty
     */
    public List<String> getAllSubfields(final String tag, final String code) {
        final List<String> result = Lists.newArrayList();
        for (final Marc21Field field : getFields(tag)) {
            final String value = field.getSubfield(code);
            if (value != null) {
                result.add(value);
            }
        }
        return result;
    }

    @Override
    public Map<String, Object> toMap() {
        final Map<String, Object> map = Maps.newLinkedHashMap();
        if (this.leader != null) {
            map.put("leader", this.leader);
        }
        map.put("controlfields", Maps.newLinkedHashMap(this.controlFields));
        final List<Object> fieldList = Lists.newArrayList();
        for (final Marc21Field field : this.fields) {
            final Map<String, Object> fieldMap = Maps.newLinkedHashMap();
            fieldMap.put("tag", field.getTag());
            fieldMap.put("ind1", field.getIndicator1());
            fieldMap.put("ind2", field.getIndicator2());
            final List<Object> subfieldList = Lists.newArrayList();
            for (final Map.Entry<String, String> entry : field.getSubfields().entries()) {
                final Map<String, Object> subfieldMap = Maps.newLinkedHashMap();
                subfieldMap.put("code", entry.getKey());
                subfieldMap.put("text", entry.getValue());
                subfieldList.add(subfieldMap);
            }
            fieldMap.put("subfields", subfieldList);
            fieldList.add(fieldMap);
        }
        map.put("datafields", fieldList);
        return map;
    }

    @Override
    public String toString() {
        return Joiner.on('\n').join(this.fields);
    }

}
