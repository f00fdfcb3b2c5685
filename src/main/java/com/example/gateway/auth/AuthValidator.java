package com.example.gateway.auth;

/**
 * Verifies bearer tokens issued by the identity service.
 */
public interface AuthValidator {

    /**
     * @throws AuthenticationFailedException for a bad signature, an expired token, a token whose
     *     {@code type} claim is not {@code access}, or one without a caller identity
     */
    AuthenticatedCaller verify(String token);

    /**
     * Same as {@link #verify(String)} for a raw {@code Authorization} header value.
     */
    default AuthenticatedCaller verifyHeader(String authorization) {
        if (authorization == null || !authorization.startsWith("Bearer ")) {
            throw new AuthenticationFailedException("Invalid token format");
        }
        return verify(authorization.substring("Bearer ".length()).trim());
    }
}
