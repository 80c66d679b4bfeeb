package de.bsommerfeld.forum.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Credential hashing parameters. The round count only affects newly stored
 * credentials; existing ones carry their own count and keep verifying.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SecurityConfig {

    @JsonProperty("PasswordRounds")
    private int passwordRounds = 25000;

    public int getPasswordRounds() {
        return passwordRounds;
    }

    public void setPasswordRounds(int passwordRounds) {
        this.passwordRounds = passwordRounds;
    }
}
