package dev.catananti.cms.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Table("users")
@Getter
@Setter
@ToString(exclude = {"passwordHash"})
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    @Id
    private Long id;

    /** Stored lower-cased. */
    private String email;

    private String username;

    @Column("password_hash")
    private String passwordHash;

    @Column("first_name")
    private String firstName;

    @Column("last_name")
    private String lastName;

    @Column("is_active")
    @Builder.Default
    private Boolean active = true;

    @Column("is_staff")
    @Builder.Default
    private Boolean staff = false;

    @Column("is_superuser")
    @Builder.Default
    private Boolean superuser = false;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    @Column("last_login")
    private LocalDateTime lastLogin;

    public String fullName() {
        String full = (nullToEmpty(firstName) + " " + nullToEmpty(lastName)).trim();
        return full.isEmpty() ? username : full;
    }

    public String displayName() {
        boolean hasName = (firstName != null && !firstName.isBlank()) || (lastName != null && !lastName.isBlank());
        return hasName ? fullName() : username;
    }

    /** Staff and superusers may moderate any content. */
    public boolean hasStaffRights() {
        return Boolean.TRUE.equals(staff) || Boolean.TRUE.equals(superuser);
    }

    /** Role name carried in access tokens. */
    public String roleName() {
        if (Boolean.TRUE.equals(superuser)) return UserRole.ADMIN.name();
        if (Boolean.TRUE.equals(staff)) return UserRole.STAFF.name();
        return UserRole.USER.name();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
