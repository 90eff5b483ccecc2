package com.github.dimitryivaniuta.gateway.esim.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.esim.config.AppProperties;
import com.github.dimitryivaniuta.gateway.esim.web.dto.ErrorResponse;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Requires the operations token on {@code /api/**}.
 *
 * <p>Header: {@code X-Ops-Token}. Webhook and actuator routes are not affected.</p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class OpsApiTokenFilter extends OncePerRequestFilter {

    public static final String OPS_TOKEN_HEADER = "X-Ops-Token";

    private static final String API_PREFIX = "/api/";

    private final byte[] expected;
    private final ObjectMapper objectMapper;

    public OpsApiTokenFilter(AppProperties properties, ObjectMapper objectMapper) {
        this.expected = properties.getOps().getApiToken().getBytes(StandardCharsets.UTF_8);
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(API_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String presented = request.getHeader(OPS_TOKEN_HEADER);
        if (presented == null || !MessageDigest.isEqual(expected, presented.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected operations call without a valid token. method={} uri={}",
                    request.getMethod(), request.getRequestURI());
            response.setStatus(HttpStatus.UNAUTHORIZED.value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(),
                    ErrorResponse.of("UNAUTHORIZED", "Missing or invalid " + OPS_TOKEN_HEADER));
            return;
        }
        filterChain.doFilter(request, response);
    }
}
