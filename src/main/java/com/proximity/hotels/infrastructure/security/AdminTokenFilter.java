package com.proximity.hotels.infrastructure.security;

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
import java.util.Set;

/**
 * Guards hotel mutations (POST, PUT, DELETE under /api/v1/hotels) with a static bearer
 * token. Reads and search stay public.
 */
@Component
public class AdminTokenFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(AdminTokenFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";
    private static final String PROTECTED_PATH = "/api/v1/hotels";
    private static final Set<String> PROTECTED_METHODS = Set.of("POST", "PUT", "DELETE");

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
        String requestUri = request.getRequestURI();
        boolean hotelPath = requestUri.equals(PROTECTED_PATH) || requestUri.startsWith(PROTECTED_PATH + "/");
        return !hotelPath || !PROTECTED_METHODS.contains(request.getMethod());
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
            sendErrorResponse(response, HttpServletResponse.SC_UNAUTHORIZED,
                "UNAUTHORIZED", "Missing or invalid Authorization header");
            return;
        }

        String token = authHeader.substring(BEARER_PREFIX.length());

        if (!constantTimeEquals(adminToken, token)) {
            logger.warn("Invalid admin token provided for {} {}", request.getMethod(), request.getRequestURI());
            sendErrorResponse(response, HttpServletResponse.SC_UNAUTHORIZED,
                "UNAUTHORIZED", "Invalid token");
            return;
        }

        logger.debug("Admin request authenticated");
        filterChain.doFilter(request, response);
    }

    private void sendErrorResponse(HttpServletResponse response, int status,
                                   String error, String message) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());

        Map<String, String> errorBody = Map.of(
            "error", error,
            "message", message
        );

        response.getWriter().write(objectMapper.writeValueAsString(errorBody));
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            actual.getBytes(StandardCharsets.UTF_8));
    }
}
