package storefront.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Either {@code username} or {@code email} identifies the account; the service rejects a
 * request carrying neither.
 */
public class LoginRequest {
    private String username;
    private String email;

    @NotBlank
    private String password;

    public String getUsername() {
        return username;
    }

    public String getEmail() {
        return email;
    }

    public String getPassword() {
        return password;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public void setPassword(String password) {
        this.password = password;
    }
}
