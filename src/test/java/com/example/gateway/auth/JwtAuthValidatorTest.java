package com.example.gateway.auth;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtAuthValidatorTest {

    private static final String SECRET = "test-secret-for-hmac-signing-0123456789abcdef";
    private static final String OTHER_SECRET = "another-secret-that-is-long-enough-0123456789";

    private JwtAuthValidator validator;

    @BeforeEach
    void setUp() {
        SecretKeySpec key = new SecretKeySpec(SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        validator = new JwtAuthValidator(NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build());
    }

    @Test
    void acceptsAccessTokenAndReadsUserIdClaim() throws Exception {
        String token = sign(SECRET, claims().claim("type", "access").claim("user_id", "u-1").subject("ignored"));

        AuthenticatedCaller caller = validator.verifyHeader("Bearer " + token);

        assertThat(caller.userId()).isEqualTo("u-1");
        assertThat(caller.claims()).containsEntry("type", "access");
    }

    @Test
    void fallsBackToSubject() throws Exception {
        String token = sign(SECRET, claims().claim("type", "access").subject("u-2"));

        assertThat(validator.verify(token).userId()).isEqualTo("u-2");
    }

    @Test
    void rejectsRefreshToken() throws Exception {
        String token = sign(SECRET, claims().claim("type", "refresh").claim("user_id", "u-1"));

        assertThatThrownBy(() -> validator.verify(token))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("Invalid token type");
    }

    @Test
    void rejectsExpiredToken() throws Exception {
        String token = sign(SECRET, new JWTClaimsSet.Builder()
                .claim("type", "access")
                .claim("user_id", "u-1")
                .expirationTime(Date.from(Instant.now().minusSeconds(3600))));

        assertThatThrownBy(() -> validator.verify(token))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("Invalid or expired token");
    }

    @Test
    void rejectsForeignSignature() throws Exception {
        String token = sign(OTHER_SECRET, claims().claim("type", "access").claim("user_id", "u-1"));

        assertThatThrownBy(() -> validator.verify(token))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("Invalid or expired token");
    }

    @Test
    void rejectsTokenWithoutIdentity() throws Exception {
        String token = sign(SECRET, claims().claim("type", "access"));

        assertThatThrownBy(() -> validator.verify(token))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("Token carries no caller identity");
    }

    @Test
    void rejectsGarbage() {
        assertThatThrownBy(() -> validator.verify("not.a.jwt"))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("Invalid or expired token");
    }

    @Test
    void headerWithoutBearerPrefixIsRejected() throws Exception {
        String token = sign(SECRET, claims().claim("type", "access").claim("user_id", "u-1"));

        assertThatThrownBy(() -> validator.verifyHeader(token))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("Invalid token format");
        assertThatThrownBy(() -> validator.verifyHeader(null))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("Invalid token format");
    }

    private static JWTClaimsSet.Builder claims() {
        return new JWTClaimsSet.Builder().expirationTime(Date.from(Instant.now().plusSeconds(3600)));
    }

    private static String sign(String secret, JWTClaimsSet.Builder claims) throws Exception {
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims.build());
        jwt.sign(new MACSigner(secret.getBytes(StandardCharsets.UTF_8)));
        return jwt.serialize();
    }
}
