package app.revisio.core.security;

import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class CurrentUserProvider {

    /**
     * Reads the learner id from the {@code user_id} claim, or from {@code sub} for tokens that carry the id there.
     */
    public UUID getUserId(Jwt jwt) {
        if (jwt == null) {
            throw new IllegalStateException("No authenticated token");
        }
        String claim = jwt.getClaimAsString("user_id");
        if (claim == null) {
            claim = jwt.getSubject();
        }
        if (claim == null) {
            throw new IllegalStateException("JWT does not contain a 'user_id' claim");
        }
        try {
            return UUID.fromString(claim);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("JWT user id is not a UUID: " + claim, e);
        }
    }
}
