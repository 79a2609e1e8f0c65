package storefront.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import storefront.domain.User;

/**
 * Public view of a user. Never carries the password hash.
 */
public class UserResponse {
    private Long id;
    private String username;
    private String email;
    private boolean admin;

    public static UserResponse from(User u) {
        var r = new UserResponse();
        r.id = u.getId();
        r.username = u.getUsername();
        r.email = u.getEmail();
        r.admin = u.isAdmin();
        return r;
    }

    public Long getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public String getEmail() {
        return email;
    }

    @JsonProperty("is_admin")
    public boolean isAdmin() {
        return admin;
    }
}
