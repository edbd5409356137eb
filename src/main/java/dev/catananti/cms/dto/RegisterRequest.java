package dev.catananti.cms.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.catananti.cms.validation.InputValidator;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "Email is required")
        @Email(message = "Invalid email format")
        @Size(max = 255, message = "Email must not exceed 255 characters")
        String email,

        @NotBlank(message = "Username is required")
        @Size(min = 3, max = 30, message = "Username must be between 3 and 30 characters")
        @Pattern(regexp = InputValidator.USERNAME_REGEX, message = "Username can only contain letters, numbers, and underscores")
        String username,

        @NotBlank(message = "Password is required")
        @Size(min = 8, max = 128, message = "Password must be between 8 and 128 characters")
        @Pattern(regexp = InputValidator.PASSWORD_REGEX,
                message = "Password must contain uppercase, lowercase, number, and special character")
        String password,

        @JsonProperty("first_name")
        @Size(max = 50, message = "First name must not exceed 50 characters")
        String firstName,

        @JsonProperty("last_name")
        @Size(max = 50, message = "Last name must not exceed 50 characters")
        String lastName
) {
}
