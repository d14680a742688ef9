package io.github.jakubt4.satti.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Set;

/**
 * Requires the shared API key in the {@code x-api-key} header on every non-public path.
 *
 * <p>{@code /downloads/**} also accepts the key as the {@code api_key} query parameter, for plain
 * browser links. Preflight requests pass untouched.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class ApiKeyFilter extends OncePerRequestFilter {

    public static final String API_KEY_HEADER = "x-api-key";
    static final String API_KEY_PARAM = "api_key";
    private static final Set<String> PUBLIC_PATHS = Set.of("/", "/health");

    private final byte[] apiKey;
    private final ObjectMapper objectMapper;

    public ApiKeyFilter(@Value("${satti.security.api-key:change-me}") final String apiKey,
                        final ObjectMapper objectMapper) {
        this.apiKey = apiKey.getBytes(StandardCharsets.UTF_8);
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(final HttpServletRequest request) {
        return HttpMethod.OPTIONS.matches(request.getMethod()) || PUBLIC_PATHS.contains(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(final HttpServletRequest request,
                                    final HttpServletResponse response,
                                    final FilterChain chain) throws ServletException, IOException {
        var presented = request.getHeader(API_KEY_HEADER);
        if ((presented == null || presented.isEmpty()) && request.getRequestURI().startsWith("/downloads/")) {
            presented = request.getParameter(API_KEY_PARAM);
        }

        if (presented == null
                || !MessageDigest.isEqual(apiKey, presented.getBytes(StandardCharsets.UTF_8))) {
            log.warn("[AUTH] Rejected {} {} from {}", request.getMethod(), request.getRequestURI(),
                    request.getRemoteAddr());
            ErrorWriter.write(objectMapper, response, HttpStatus.UNAUTHORIZED, "Unauthorized");
            return;
        }
        chain.doFilter(request, response);
    }
}
