package nl.uu.edpop.explorer.data;

import javax.annotation.Nullable;

import nl.uu.edpop.explorer.vocabulary.EDPOPREC;

/**
 * A field naming a person or organization that contributed to a work, with an optional role
 * (e.g., "printer").
 */
public class ContributorField extends Field {

    public static final String NAME = "name";

    public static final String ROLE = "role";

    public ContributorField(final String originalText) throws FieldException {
        super(EDPOPREC.CONTRIBUTOR_FIELD, originalText);
        addSubfield(NAME, EDPOPREC.NAME, Datatype.STRING);
        addSubfield(ROLE, EDPOPREC.ROLE, Datatype.STRING);
    }

    @Nullable
    public String getName() {
        return (String) get(NAME);
    }

    public void setName(@Nullable final String name) {
        set(NAME, name);
    }

    @Nullable
    public String getRole() {
        return (String) get(ROLE);
    }

    public void setRole(@Nullable final String role) {
        set(ROLE, role);
    }

    @Override
    @Nullable
    public String getSummaryText() {
        final Object name = get(NAME);
        if (name == null) {
            return null;
        }
        final Object role = get(ROLE);
        return role == null ? name.toString() : name + " (" + role + ")";
    }

}
