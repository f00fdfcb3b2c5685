package com.example.gateway.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;

@Configuration
public class JwtConfig {

    @Bean
    JwtDecoder jwtDecoder(JwtProperties properties) {
        MacAlgorithm algorithm = MacAlgorithm.from(properties.algorithm());
        if (algorithm == null) {
            throw new IllegalStateException("Unsupported JWT algorithm: " + properties.algorithm());
        }
        // HS256 -> HmacSHA256
        String jcaName = "HmacSHA" + algorithm.getName().substring(2);
        SecretKeySpec key = new SecretKeySpec(properties.secret().getBytes(StandardCharsets.UTF_8), jcaName);
        return NimbusJwtDecoder.withSecretKey(key).macAlgorithm(algorithm).build();
    }
}
