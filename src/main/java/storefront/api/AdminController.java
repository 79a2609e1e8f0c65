package storefront.api;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import storefront.service.AuthorizationService;

import java.util.Map;

@RestController
public class AdminController {

    private final AuthorizationService authorization;

    public AdminController(AuthorizationService authorization) {
        this.authorization = authorization;
    }

    // diagnostic: reports the caller's current admin flag
    @GetMapping("/is_admin")
    public Map<String, Boolean> isAdmin(@AuthenticationPrincipal Long userId) {
        return Map.of("is_admin", authorization.isAdmin(userId));
    }
}
