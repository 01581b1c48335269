package warden.adapter.in.dto;

import java.util.Map;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for login requests.
 *
 * @param email      account email (required)
 * @param password   account password (required)
 * @param deviceInfo optional client-supplied device metadata, stored with the session
 */
public record LoginRequest(
        @NotBlank(message = "email is required") @Email @Size(max = 255) String email,
        @NotNull(message = "password is required") @Size(max = 1024) String password,
        @JsonProperty("device_info") @Size(max = 32) Map<String, Object> deviceInfo) {}
