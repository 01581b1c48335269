package warden.adapter.in.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for refresh requests.
 *
 * @param refreshToken the refresh secret returned by the previous login or refresh
 */
public record RefreshRequest(
        @JsonProperty("refresh_token") @NotBlank(message = "refresh_token is required") @Size(max = 512)
                String refreshToken) {}
