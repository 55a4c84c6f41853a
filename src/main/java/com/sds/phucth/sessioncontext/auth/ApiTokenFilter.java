package com.sds.phucth.sessioncontext.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sds.phucth.sessioncontext.dto.ApiErrorResponse;
import com.sds.phucth.sessioncontext.exceptions.ErrorCode;
import com.sds.phucth.sessioncontext.utils.Hashing;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Map;

/**
 * Bearer token check for every {@code /api/**} request. The token is a single shared
 * secret from {@code app.auth.apiToken}; when it is not configured all API calls are refused.
 *
 * <p>Registered as a servlet filter via {@link com.sds.phucth.sessioncontext.config.WebConfig}.
 */
@Component
@Slf4j
public class ApiTokenFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final String apiToken;
    private final ObjectMapper objectMapper;

    public ApiTokenFilter(@Value("${app.auth.apiToken:}") String apiToken, ObjectMapper objectMapper) {
        this.apiToken = apiToken;
        this.objectMapper = objectMapper;
        if (apiToken == null || apiToken.isBlank()) {
            log.warn("app.auth.apiToken is not set, every /api request will be rejected");
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authHeader = request.getHeader("Authorization");
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            writeUnauthorized(response, request.getRequestURI(), "Missing or invalid Authorization header");
            return;
        }

        String token = authHeader.substring(BEARER_PREFIX.length()).strip();
        if (apiToken == null || apiToken.isBlank() || !Hashing.secretsMatch(apiToken, token)) {
            log.debug("Rejected API token for {}", request.getRequestURI());
            writeUnauthorized(response, request.getRequestURI(), "Invalid API token");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void writeUnauthorized(HttpServletResponse response, String path, String message) throws IOException {
        ApiErrorResponse errorResponse = ApiErrorResponse.of(ErrorCode.UNAUTHORIZED, message, Map.of(), path);
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), errorResponse);
    }
}
