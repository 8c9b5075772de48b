package com.quillkv.gateway.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quillkv.auth.SessionTokenService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.util.WebUtils;

/** Rejects admin API calls that do not carry a valid {@code auth} cookie. */
public class AdminAuthInterceptor implements HandlerInterceptor {

    static final String CLAIMS_ATTRIBUTE = "quillkv.session";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SessionTokenService tokens;

    public AdminAuthInterceptor(SessionTokenService tokens) {
        this.tokens = tokens;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws Exception {
        var cookie = WebUtils.getCookie(request, SessionCookies.NAME);
        var claims = cookie == null ? null : tokens.verify(cookie.getValue()).orElse(null);
        if (claims == null) {
            response.setStatus(HttpStatus.UNAUTHORIZED.value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            MAPPER.writeValue(response.getOutputStream(), ApiResponses.UNAUTHORIZED);
            return false;
        }
        request.setAttribute(CLAIMS_ATTRIBUTE, claims);
        return true;
    }
}
