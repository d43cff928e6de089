package de.jwiegmann.trainingdata.boundary.auth;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Token-Verifier auf Basis einer statischen Liste {@code token=userId,token2=userId2} aus der Konfiguration.
 */
@Slf4j
@Component
public class StaticTokenVerifier implements TokenVerifier {

    private final Map<String, String> userIdsByToken;

    public StaticTokenVerifier(@Value("${auth.tokens:}") String tokens) {
        this.userIdsByToken = parse(tokens);
        if (userIdsByToken.isEmpty()) {
            log.warn("No bearer tokens configured (auth.tokens); every request will be rejected");
        }
    }

    @Override
    public Optional<String> resolveUserId(String bearerToken) {
        if (bearerToken == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(userIdsByToken.get(bearerToken));
    }

    static Map<String, String> parse(String tokens) {
        Map<String, String> result = new HashMap<>();
        if (tokens == null || tokens.isBlank()) {
            return result;
        }
        for (String entry : tokens.split(",")) {
            int separator = entry.indexOf('=');
            if (separator <= 0 || separator == entry.length() - 1) {
                throw new IllegalArgumentException("invalid auth.tokens entry: " + entry);
            }
            result.put(entry.substring(0, separator).trim(), entry.substring(separator + 1).trim());
        }
        return result;
    }
}
