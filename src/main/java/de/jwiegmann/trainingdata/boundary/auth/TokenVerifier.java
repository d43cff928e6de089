package de.jwiegmann.trainingdata.boundary.auth;

import java.util.Optional;

/**
 * Löst ein Bearer-Token zu einer userId auf. Die eigentliche Prüfung (Signatur, Ablauf) liegt beim Identity-Provider.
 */
public interface TokenVerifier {

    Optional<String> resolveUserId(String bearerToken);
}
