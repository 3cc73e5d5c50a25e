package dev.resumeranker.model;

/**
 * Contact fields extracted from a resume. Absent fields are empty strings.
 * The phone number is kept in canonical {@code +<digits>} form.
 */
public record ContactInfo(String name, String email, String phone) {

    public static final ContactInfo EMPTY = new ContactInfo("", "", "");

    public ContactInfo {
        name = name == null ? "" : name;
        email = email == null ? "" : email;
        phone = phone == null ? "" : phone;
    }

    public boolean hasName() {
        return !name.isBlank();
    }

    public boolean hasEmail() {
        return !email.isBlank();
    }

    public boolean hasPhone() {
        return !phone.isBlank();
    }

    /**
     * Number of populated contact fields (0-3).
     */
    public int completeness() {
        int count = 0;
        if (hasName()) count++;
        if (hasEmail()) count++;
        if (hasPhone()) count++;
        return count;
    }
}
