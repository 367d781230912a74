package com.candidateprep.coach.filter;

import com.candidateprep.coach.service.RateLimiterService;
import com.candidateprep.coach.service.RateLimiterService.RateLimitStatus;
import com.candidateprep.coach.service.RateLimiterService.WindowStatus;
import com.candidateprep.coach.session.SessionRegistry;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Limits the endpoints that call the language model. Clients are told apart by
 * {@code X-Client-Id}, or by address when the header is missing.
 */
@Component
@Order(1)
public class RateLimitFilter extends OncePerRequestFilter {

    private static final List<String> LIMITED_PREFIXES = List.of(
        "/api/practice",
        "/api/mock-interview"
    );

    private final RateLimiterService rateLimiterService;

    public RateLimitFilter(RateLimiterService rateLimiterService) {
        this.rateLimiterService = rateLimiterService;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!"POST".equalsIgnoreCase(request.getMethod())) return true;
        String path = request.getRequestURI();
        return LIMITED_PREFIXES.stream().noneMatch(path::startsWith);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        RateLimitStatus status = rateLimiterService.consume(clientKey(request));
        response.setHeader("X-RateLimit-Limit", String.valueOf(status.limit()));
        response.setHeader("X-RateLimit-Remaining", String.valueOf(status.remaining()));
        response.setHeader("X-RateLimit-Reset", String.valueOf(status.resetSeconds()));
        for (WindowStatus window : status.windows()) {
            String name = Character.toUpperCase(window.name().charAt(0)) + window.name().substring(1);
            response.setHeader("X-RateLimit-" + name + "-Remaining", String.valueOf(window.remaining()));
        }

        if (!status.allowed()) {
            response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.getWriter().write("""
                {"error": "Too many requests. Please slow down.", "status": 429}
                """);
            return;
        }

        filterChain.doFilter(request, response);
    }

    private String clientKey(HttpServletRequest request) {
        String clientId = request.getHeader(SessionRegistry.CLIENT_HEADER);
        if (clientId != null && !clientId.isBlank()) {
            return "client:" + clientId.strip();
        }
        // proxies and load balancers
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isEmpty()) {
            return "ip:" + forwarded.split(",")[0].trim();
        }
        return "ip:" + request.getRemoteAddr();
    }
}
