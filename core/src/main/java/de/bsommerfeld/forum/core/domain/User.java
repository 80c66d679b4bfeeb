package de.bsommerfeld.forum.core.domain;

import java.time.LocalDateTime;

/**
 * Immutable snapshot of a row in the {@code Users} table.
 *
 * @param id        surrogate key assigned by the store
 * @param firstName given name
 * @param lastName  family name
 * @param email     login identifier, unique across all users
 * @param password  stored credential in {@code $pbkdf2-sha512$...} form, never
 *                  the plaintext secret
 * @param admin     whether the user holds administrative rights
 * @param bio       free-text profile description, {@code null} if unset
 * @param addedOn   registration time
 */
public record User(
        int id,
        String firstName,
        String lastName,
        String email,
        String password,
        boolean admin,
        String bio,
        LocalDateTime addedOn) {

    /**
     * Keeps the stored credential out of log lines and debugger views.
     */
    @Override
    public String toString() {
        return "User[id=" + id + ", firstName=" + firstName + ", lastName=" + lastName
                + ", email=" + email + ", password=<redacted>, admin=" + admin
                + ", bio=" + bio + ", addedOn=" + addedOn + "]";
    }
}
