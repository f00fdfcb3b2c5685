package com.example.gateway.api;

import com.example.gateway.auth.AuthValidator;
import com.example.gateway.auth.AuthenticatedCaller;
import com.example.gateway.auth.AuthenticationFailedException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AuthController.class)
class AuthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AuthValidator authValidator;

    @Test
    void validTokenReturnsCaller() throws Exception {
        when(authValidator.verifyHeader("Bearer good")).thenReturn(new AuthenticatedCaller("u-1", Map.of()));

        mockMvc.perform(post("/api/v1/auth/verify").header("Authorization", "Bearer good"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.valid").value(true))
                .andExpect(jsonPath("$.data.user_id").value("u-1"))
                .andExpect(jsonPath("$.message").value("Token is valid"));
    }

    @Test
    void invalidTokenIs401() throws Exception {
        when(authValidator.verifyHeader("Bearer bad")).thenThrow(new AuthenticationFailedException("Invalid or expired token"));

        mockMvc.perform(post("/api/v1/auth/verify").header("Authorization", "Bearer bad"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("WWW-Authenticate", "Bearer"))
                .andExpect(jsonPath("$.error").value("Invalid or expired token"));
    }
}
