package com.github.dimitryivaniuta.gateway.esim.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Puts a correlation id, and the storefront webhook id when present, into the logging MDC.
 *
 * <p>Header: {@code X-Correlation-Id}. If missing, the webhook id is used, then a new UUID.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

    public static final String MDC_KEY = "correlationId";

    public static final String MDC_WEBHOOK_ID = "webhookId";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String webhookId = nonBlank(request.getHeader(WebhookController.WEBHOOK_ID_HEADER)).orElse(null);
        String correlationId = nonBlank(request.getHeader(CORRELATION_ID_HEADER))
                .or(() -> Optional.ofNullable(webhookId))
                .orElseGet(() -> UUID.randomUUID().toString());

        MDC.put(MDC_KEY, correlationId);
        if (webhookId != null) {
            MDC.put(MDC_WEBHOOK_ID, webhookId);
        }
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
            MDC.remove(MDC_WEBHOOK_ID);
        }
    }

    private static Optional<String> nonBlank(String v) {
        return Optional.ofNullable(v).filter(s -> !s.isBlank());
    }
}
