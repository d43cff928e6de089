package de.jwiegmann.trainingdata.boundary.auth;

import de.jwiegmann.trainingdata.control.UploadErrorFactory;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Prüft das Bearer-Token jedes Requests und legt die aufgelöste userId als Request-Attribut ab.
 * Ein abweichender userId-Parameter wird mit 403 abgewiesen.
 */
@Component
@RequiredArgsConstructor
public class BearerAuthInterceptor implements HandlerInterceptor {

    public static final String AUTHENTICATED_USER = "authenticatedUserId";

    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenVerifier tokenVerifier;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            throw UploadErrorFactory.unauthorized();
        }

        String userId = tokenVerifier.resolveUserId(header.substring(BEARER_PREFIX.length()).trim())
                .orElseThrow(UploadErrorFactory::unauthorized);

        String requestedUser = request.getParameter("userId");
        if (requestedUser != null && !requestedUser.equals(userId)) {
            throw UploadErrorFactory.forbidden(requestedUser);
        }

        request.setAttribute(AUTHENTICATED_USER, userId);
        return true;
    }
}
