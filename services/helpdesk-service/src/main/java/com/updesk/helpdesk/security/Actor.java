package com.updesk.helpdesk.security;

import org.springframework.http.HttpStatus;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

/**
 * The authenticated user behind a request, as asserted by the identity provider.
 * E-mail and display name are optional claims.
 */
public record Actor(Long userId, String email, String displayName) {

    static final String USER_ID_CLAIM = "uid";
    static final String EMAIL_CLAIM = "email";
    static final String NAME_CLAIM = "name";

    /**
     * Reads the actor from a validated token: the numeric {@code uid} claim, or a
     * numeric subject when {@code uid} is absent.
     *
     * @throws ResponseStatusException 401 when the token has no numeric identity
     */
    public static Actor from(Jwt jwt) {
        if (jwt == null) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Usuário não autenticado.");
        }
        Long userId = parseId(jwt.getClaimAsString(USER_ID_CLAIM));
        if (userId == null) {
            userId = parseId(jwt.getSubject());
        }
        if (userId == null) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Token sem identificação numérica do usuário.");
        }
        return new Actor(userId, jwt.getClaimAsString(EMAIL_CLAIM), jwt.getClaimAsString(NAME_CLAIM));
    }

    private static Long parseId(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return Long.valueOf(value.trim());
        } catch (NumberFormatException notNumeric) {
            return null;
        }
    }
}
