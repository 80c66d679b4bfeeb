package de.bsommerfeld.forum.db;

/**
 * Options for {@link ForumDatabase#modifyUser}. A new password is given in
 * plaintext and hashed by the accessor before it is stored.
 */
public final class UserChanges extends ColumnChanges {

    private String password;

    public UserChanges firstName(String firstName) {
        setRequired("FirstName", firstName);
        return this;
    }

    public UserChanges lastName(String lastName) {
        setRequired("LastName", lastName);
        return this;
    }

    public UserChanges email(String email) {
        setRequired("Email", email);
        return this;
    }

    public UserChanges password(String plaintext) {
        this.password = plaintext;
        return this;
    }

    public UserChanges admin(boolean admin) {
        set("Admin", admin);
        return this;
    }

    /** {@code null} clears the bio. */
    public UserChanges bio(String bio) {
        set("Bio", bio);
        return this;
    }

    String password() {
        return password;
    }

    @Override
    public boolean isEmpty() {
        return super.isEmpty() && password == null;
    }
}
