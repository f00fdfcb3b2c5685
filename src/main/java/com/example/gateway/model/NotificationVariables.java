package com.example.gateway.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.util.Map;

/**
 * Template variables carried to the downstream workers. {@code meta} is passed through untouched.
 */
public record NotificationVariables(
        @NotBlank(message = "variables.name is required") String name,
        @NotNull(message = "variables.link is required")
        @Pattern(regexp = "^https?://[^\\s/$.?#][^\\s]*$", message = "variables.link must be an absolute http(s) URL")
        String link,
        Map<String, Object> meta
) {}
