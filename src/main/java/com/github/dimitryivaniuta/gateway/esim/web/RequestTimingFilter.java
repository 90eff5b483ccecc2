package com.github.dimitryivaniuta.gateway.esim.web;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Logs method, path, status and duration of every request; webhook latency is also recorded as a timer
 * because the storefront gives up on slow endpoints.
 */
@Slf4j
@Component
public class RequestTimingFilter extends OncePerRequestFilter {

    private final Timer webhookTimer;

    public RequestTimingFilter(MeterRegistry meterRegistry) {
        this.webhookTimer = Timer.builder("esim.webhook.latency").register(meterRegistry);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {
        long t0 = System.nanoTime();
        try {
            chain.doFilter(req, res);
        } finally {
            long nanos = System.nanoTime() - t0;
            if (req.getRequestURI().startsWith("/webhook/")) {
                webhookTimer.record(nanos, TimeUnit.NANOSECONDS);
            }
            log.info("HTTP {} {} -> {} in {}ms", req.getMethod(), req.getRequestURI(), res.getStatus(), nanos / 1_000_000);
        }
    }
}
