package dev.catananti.cms.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.catananti.cms.entity.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UserResponse {
    private Long id;
    private String email;
    private String username;
    private String fullName;
    private String displayName;
    private Boolean isStaff;
    private Boolean isSuperuser;
    private LocalDateTime lastLogin;

    public static UserResponse summary(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .email(user.getEmail())
                .username(user.getUsername())
                .fullName(user.fullName())
                .build();
    }

    public static UserResponse from(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .email(user.getEmail())
                .username(user.getUsername())
                .fullName(user.fullName())
                .displayName(user.displayName())
                .isStaff(Boolean.TRUE.equals(user.getStaff()))
                .isSuperuser(Boolean.TRUE.equals(user.getSuperuser()))
                .lastLogin(user.getLastLogin())
                .build();
    }
}
