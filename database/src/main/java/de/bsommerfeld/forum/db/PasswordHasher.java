package de.bsommerfeld.forum.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * PBKDF2-HMAC-SHA512 credentials in the modular-crypt layout used by passlib's
 * {@code pbkdf2_sha512}:
 *
 * <pre>
 * $pbkdf2-sha512$&lt;rounds&gt;$&lt;salt&gt;$&lt;checksum&gt;
 * </pre>
 *
 * Salt (16 bytes) and checksum (64 bytes) use passlib's adapted base64: the
 * standard alphabet with {@code .} in place of {@code +} and no padding.
 * Credentials already stored in that format verify without migration.
 */
public final class PasswordHasher {

    private static final Logger LOG = LoggerFactory.getLogger(PasswordHasher.class);

    static final String SCHEME = "pbkdf2-sha512";
    private static final String ALGORITHM = "PBKDF2WithHmacSHA512";
    private static final int SALT_BYTES = 16;
    private static final int CHECKSUM_BYTES = 64;

    private final SecureRandom random = new SecureRandom();
    private final int rounds;
    private final String decoy;

    /**
     * @param rounds PBKDF2 iteration count for newly hashed passwords
     */
    public PasswordHasher(int rounds) {
        if (rounds < 1)
            throw new IllegalArgumentException("rounds must be positive: " + rounds);
        this.rounds = rounds;
        this.decoy = hash("decoy-" + random.nextLong());
    }

    /**
     * Derives a new credential with a fresh random salt.
     *
     * @throws IllegalArgumentException if the password is null or empty
     */
    public String hash(String password) {
        if (password == null || password.isEmpty())
            throw new IllegalArgumentException("Password must not be empty");
        byte[] salt = new byte[SALT_BYTES];
        random.nextBytes(salt);
        byte[] checksum = derive(password, salt, rounds, CHECKSUM_BYTES);
        return "$" + SCHEME + "$" + rounds + "$" + encode(salt) + "$" + encode(checksum);
    }

    /**
     * Checks a password against a stored credential, comparing in constant
     * time. A credential in an unknown format never matches.
     */
    public boolean verify(String password, String stored) {
        if (password == null || password.isEmpty() || stored == null)
            return false;

        String[] parts = stored.split("\\$");
        // "", scheme, rounds, salt, checksum
        if (parts.length != 5 || !parts[0].isEmpty() || !SCHEME.equals(parts[1])) {
            LOG.warn("Stored credential has an unrecognised format");
            return false;
        }
        try {
            int storedRounds = Integer.parseInt(parts[2]);
            byte[] salt = decode(parts[3]);
            byte[] expected = decode(parts[4]);
            if (storedRounds < 1 || expected.length == 0) {
                LOG.warn("Stored credential has invalid parameters");
                return false;
            }
            byte[] actual = derive(password, salt, storedRounds, expected.length);
            return MessageDigest.isEqual(expected, actual);
        } catch (IllegalArgumentException e) {
            LOG.warn("Stored credential could not be decoded: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Burns the same work as a real verification and returns {@code false}.
     * Used when no credential exists, so a missing account cannot be told
     * apart from a wrong password by response time.
     */
    public boolean verifyAgainstDecoy(String password) {
        verify(password == null || password.isEmpty() ? " " : password, decoy);
        return false;
    }

    private static byte[] derive(String password, byte[] salt, int rounds, int length) {
        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), salt, rounds, length * 8);
        try {
            return SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
        } catch (NoSuchAlgorithmException e) {
            // Mandated by every JDK since 8
            throw new AssertionError(ALGORITHM + " not available", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Key derivation failed", e);
        } finally {
            spec.clearPassword();
        }
    }

    static String encode(byte[] data) {
        return Base64.getEncoder().withoutPadding().encodeToString(data).replace('+', '.');
    }

    static byte[] decode(String text) {
        return Base64.getDecoder().decode(text.replace('.', '+'));
    }
}
