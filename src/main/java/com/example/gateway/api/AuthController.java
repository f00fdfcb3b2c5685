package com.example.gateway.api;

import com.example.gateway.api.response.TokenVerification;
import com.example.gateway.auth.AuthValidator;
import com.example.gateway.auth.AuthenticatedCaller;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthValidator authValidator;

    @PostMapping("/verify")
    public ApiResponse<TokenVerification> verify(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization
    ) {
        AuthenticatedCaller caller = authValidator.verifyHeader(authorization);
        return ApiResponse.ok(new TokenVerification(true, caller.userId()), "Token is valid");
    }
}
