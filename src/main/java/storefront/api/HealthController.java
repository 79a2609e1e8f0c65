package storefront.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    @GetMapping("/health")
    public Object health() {
        return java.util.Map.of("status", "ok", "service", "storefront");
    }
}
