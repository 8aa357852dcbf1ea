package uz.greenwhite.oauth2client.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uz.greenwhite.oauth2client.exception.OAuth2ConfigurationException;
import uz.greenwhite.oauth2client.exception.OAuth2Exception;
import uz.greenwhite.oauth2client.exception.OAuth2ProtocolException;
import uz.greenwhite.oauth2client.model.AuthRequest;
import uz.greenwhite.oauth2client.service.OAuth2ClientService;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/oauth2")
@RequiredArgsConstructor
public class OAuth2EndpointController {

    private final OAuth2ClientService oAuth2ClientService;

    /**
     * Configured OAuth2 endpoints (no secrets)
     *
     * GET http://localhost:8090/api/v1/oauth2/info
     *
     * Response:
     * {
     *   "endpoints": {
     *     "google": { "grantType": "authorization_code", "accessTokenUri": "...", ... }
     *   },
     *   "grantTypes": ["authorization_code", "password"]
     * }
     */
    @GetMapping("/info")
    public ResponseEntity<?> getInformation() {
        return ResponseEntity.ok(oAuth2ClientService.getInformation());
    }

    /**
     * Authorization redirect for an endpoint
     *
     * GET http://localhost:8090/api/v1/oauth2/google/authorization?state=xyz
     */
    @GetMapping("/{endpoint}/authorization")
    public ResponseEntity<AuthRequest> authorization(@PathVariable("endpoint") String endpoint,
                                                     @RequestParam(value = "state", required = false) String state) {
        return ResponseEntity.ok(oAuth2ClientService.authorize(endpoint, state));
    }

    @ExceptionHandler(OAuth2ConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleConfiguration(OAuth2ConfigurationException e) {
        log.warn("OAuth2 configuration error: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "configuration_error", e.getMessage());
    }

    @ExceptionHandler(OAuth2Exception.class)
    public ResponseEntity<Map<String, Object>> handleOAuth2(OAuth2Exception e) {
        log.error("OAuth2 request failed: {}", e.getMessage());
        String code = e instanceof OAuth2ProtocolException protocol ? protocol.getCode() : "oauth2_error";
        return error(HttpStatus.BAD_GATEWAY, code, e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
