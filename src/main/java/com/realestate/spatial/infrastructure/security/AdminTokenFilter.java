package com.realestate.spatial.infrastructure.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

/**
 * Bearer-token check for the enrichment admin endpoints
 * ({@code /api/spatial/bulk-geocode*} and {@code /api/spatial/listings/**}).
 * Read-only endpoints pass through.
 */
@Component
public class AdminTokenFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(AdminTokenFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";
    private static final String BULK_GEOCODE_PATH = "/api/spatial/bulk-geocode";
    private static final String LISTINGS_PATH = "/api/spatial/listings/";

    private final String adminToken;
    private final ObjectMapper objectMapper;

    public AdminTokenFilter(
        @Value("${app.admin.token}") String adminToken,
        ObjectMapper objectMapper
    ) {
        this.adminToken = adminToken;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !(path.startsWith(BULK_GEOCODE_PATH) || path.startsWith(LISTINGS_PATH))
            || "OPTIONS".equals(request.getMethod());
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {

        String authHeader = request.getHeader("Authorization");
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            logger.warn("Missing or invalid Authorization header for {} {}", request.getMethod(), request.getRequestURI());
            sendErrorResponse(response, "Missing or invalid Authorization header");
            return;
        }

        String token = authHeader.substring(BEARER_PREFIX.length());
        if (adminToken == null || adminToken.isEmpty() || !constantTimeEquals(adminToken, token)) {
            logger.warn("Invalid admin token for {} {}", request.getMethod(), request.getRequestURI());
            sendErrorResponse(response, "Invalid token");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void sendErrorResponse(HttpServletResponse response, String message) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(objectMapper.writeValueAsString(Map.of(
            "error", "UNAUTHORIZED",
            "message", message
        )));
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            actual.getBytes(StandardCharsets.UTF_8));
    }
}
