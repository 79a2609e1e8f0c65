package storefront.api;

import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import storefront.api.dto.LoginRequest;
import storefront.api.dto.LoginResponse;
import storefront.api.dto.RegisterRequest;
import storefront.api.dto.UserResponse;
import storefront.security.JwtAuthenticationFilter;
import storefront.security.TokenService;
import storefront.service.AuthService;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public UserResponse register(@Valid @RequestBody RegisterRequest req) {
        var user = authService.register(
                req.getUsername(),
                req.getEmail(),
                req.getPassword(),
                Boolean.TRUE.equals(req.getIsAdmin()));
        return UserResponse.from(user);
    }

    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest req) {
        var result = authService.login(req.getUsername(), req.getEmail(), req.getPassword());

        // cookie mirrors the token for browser clients
        var cookie = ResponseCookie.from(JwtAuthenticationFilter.ACCESS_TOKEN_COOKIE, result.getToken())
                .httpOnly(true)
                .sameSite("Strict")
                .path("/")
                .maxAge(TokenService.TOKEN_TTL)
                .build();

        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookie.toString())
                .body(new LoginResponse(result.getToken(), result.getUser().getEmail(), result.getUser().isAdmin()));
    }
}
