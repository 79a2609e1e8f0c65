package storefront.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class LoginResponse {
    private final String token;
    private final String email;
    private final boolean admin;

    public LoginResponse(String token, String email, boolean admin) {
        this.token = token;
        this.email = email;
        this.admin = admin;
    }

    public String getToken() {
        return token;
    }

    public String getEmail() {
        return email;
    }

    @JsonProperty("is_admin")
    public boolean isAdmin() {
        return admin;
    }
}
