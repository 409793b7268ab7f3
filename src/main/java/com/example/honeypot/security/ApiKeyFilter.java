package com.example.honeypot.security;

import com.example.honeypot.config.HoneypotProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Rejects calls to the webhook and admin endpoints that do not carry the shared key. Runs before the
 * request reaches any controller, so a rejected call never touches session state.
 */
@Component
public class ApiKeyFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(ApiKeyFilter.class);

    private final String apiKey;
    private final String headerName;
    private final List<String> protectedPaths;

    public ApiKeyFilter(HoneypotProperties properties) {
        HoneypotProperties.SecuritySettings settings = properties.getSecurity();
        this.apiKey = settings.getApiKey() == null ? "" : settings.getApiKey().trim();
        this.headerName = settings.getHeaderName();
        this.protectedPaths = List.copyOf(settings.getProtectedPaths());
        if (apiKey.isEmpty()) {
            logger.warn("No API key configured; {} is not checked", headerName);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return uri == null || protectedPaths.stream().noneMatch(uri::startsWith);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (apiKey.isEmpty()) {
            filterChain.doFilter(request, response);
            return;
        }

        String key = request.getHeader(headerName);
        if (key != null && MessageDigest.isEqual(
                key.getBytes(StandardCharsets.UTF_8), apiKey.getBytes(StandardCharsets.UTF_8))) {
            filterChain.doFilter(request, response);
            return;
        }

        logger.warn("{} {} rejected: {} API key", request.getMethod(), request.getRequestURI(),
                key == null ? "missing" : "invalid");
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json;charset=UTF-8");
        response.getWriter().write(key == null
                ? "{\"detail\":\"Missing API key. Include " + headerName + " header.\"}"
                : "{\"detail\":\"Invalid API key.\"}");
    }
}
