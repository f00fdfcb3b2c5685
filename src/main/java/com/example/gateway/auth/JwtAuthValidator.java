package com.example.gateway.auth;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthValidator implements AuthValidator {

    static final String TYPE_CLAIM = "type";
    static final String ACCESS_TYPE = "access";
    static final String USER_ID_CLAIM = "user_id";

    private final JwtDecoder jwtDecoder;

    @Override
    public AuthenticatedCaller verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthenticationFailedException("Invalid or expired token");
        }
        Jwt jwt;
        try {
            jwt = jwtDecoder.decode(token);
        } catch (JwtException e) {
            log.warn("event=auth_invalid_token error={}", e.getMessage());
            throw new AuthenticationFailedException("Invalid or expired token", e);
        }

        if (!ACCESS_TYPE.equals(jwt.getClaimAsString(TYPE_CLAIM))) {
            log.warn("event=auth_wrong_token_type type={}", jwt.getClaimAsString(TYPE_CLAIM));
            throw new AuthenticationFailedException("Invalid token type");
        }

        String userId = jwt.getClaimAsString(USER_ID_CLAIM);
        if (userId == null || userId.isBlank()) {
            userId = jwt.getSubject();
        }
        if (userId == null || userId.isBlank()) {
            throw new AuthenticationFailedException("Token carries no caller identity");
        }
        return new AuthenticatedCaller(userId, jwt.getClaims());
    }
}
