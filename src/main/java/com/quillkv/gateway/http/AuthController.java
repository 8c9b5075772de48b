package com.quillkv.gateway.http;

import com.quillkv.audit.EventLog;
import com.quillkv.auth.CredentialManager;
import com.quillkv.auth.SessionTokenService;
import com.quillkv.observability.MetricsConfig;
import com.quillkv.shared.config.QuillKvConfig;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Login, logout and session lookup for the administrative principal. Every authentication failure
 * gets the same 401 body, whatever the cause.
 */
@RestController
public class AuthController {

    public record LoginRequest(String email, String password) {}

    private final CredentialManager credentials;
    private final SessionTokenService tokens;
    private final EventLog events;
    private final MetricsConfig metrics;
    private final QuillKvConfig config;

    public AuthController(CredentialManager credentials, SessionTokenService tokens, EventLog events,
                          MetricsConfig metrics, QuillKvConfig config) {
        this.credentials = credentials;
        this.tokens = tokens;
        this.events = events;
        this.metrics = metrics;
        this.config = config;
    }

    @PostMapping("/api/auth/login")
    public ResponseEntity<Map<String, Object>> login(@RequestBody(required = false) LoginRequest body) {
        var email = body == null ? null : body.email();
        var password = body == null ? null : body.password();
        if (email == null || !credentials.verifyPassword(email, password)) {
            metrics.loginFailure().increment();
            events.log("login_failure", Map.of("email", String.valueOf(email)));
            return ApiResponses.unauthorized();
        }
        var auth = config.auth();
        var token = tokens.issue(email, auth.sessionTtl());
        metrics.loginSuccess().increment();
        events.log("login_success", Map.of("email", email));
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, SessionCookies.issue(token, auth.sessionTtl(), auth.secureCookie()).toString())
                .body(Map.of("ok", true));
    }

    // Tokens are stateless: logout only tells the client to drop its cookie.
    @PostMapping("/api/auth/logout")
    public ResponseEntity<Map<String, Object>> logout(
            @CookieValue(name = SessionCookies.NAME, required = false) String token) {
        var claims = token == null ? null : tokens.verify(token).orElse(null);
        events.log("logout", claims == null ? Map.of() : Map.of("email", claims.sub()));
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, SessionCookies.clear(config.auth().secureCookie()).toString())
                .body(Map.of("ok", true));
    }

    @GetMapping("/api/auth/session")
    public ResponseEntity<Map<String, Object>> session(
            @CookieValue(name = SessionCookies.NAME, required = false) String token) {
        if (token == null) return ApiResponses.unauthorized();
        return tokens.verify(token)
                .map(c -> ResponseEntity.ok(Map.<String, Object>of("ok", true, "sub", c.sub(), "exp", c.exp())))
                .orElseGet(ApiResponses::unauthorized);
    }
}
