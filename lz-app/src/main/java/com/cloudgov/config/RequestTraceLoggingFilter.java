package com.cloudgov.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * HTTP 链路日志过滤器：分配 traceId / requestId 写入 MDC 与响应头，输出 HTTP_IN / HTTP_OUT。
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    static final String HEADER_TRACE_ID = "X-Trace-Id";
    static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String MDC_TRACE_ID = "traceId";
    private static final String MDC_REQUEST_ID = "requestId";
    private static final String MDC_ZONE_ID = "zoneId";
    private static final String ZONE_PATH_PATTERN = "/api/landing-zones/{zoneId}/**";

    private final ObjectMapper objectMapper;
    private final ObservabilityHttpLogProperties properties;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public RequestTraceLoggingFilter(ObjectMapper objectMapper,
                                     ObservabilityHttpLogProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!properties.isEnabled()) {
            return true;
        }
        String path = normalizePath(request.getRequestURI());
        if (matchesAny(path, properties.getExcludePathPatterns())) {
            return true;
        }
        List<String> includePatterns = properties.getIncludePathPatterns();
        return includePatterns != null && !includePatterns.isEmpty() && !matchesAny(path, includePatterns);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = headerOrRandom(request.getHeader(HEADER_TRACE_ID));
        String requestId = headerOrRandom(request.getHeader(HEADER_REQUEST_ID));
        String path = normalizePath(request.getRequestURI());
        String method = request.getMethod();
        String zoneId = resolveZoneId(path);

        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_REQUEST_ID, requestId);
        if (zoneId != null) {
            MDC.put(MDC_ZONE_ID, zoneId);
        }

        ContentCachingResponseWrapper responseWrapper = response instanceof ContentCachingResponseWrapper cached
                ? cached
                : new ContentCachingResponseWrapper(response);
        long startNs = System.nanoTime();
        log.info("HTTP_IN method={}, path={}, query={}", method, path, StringUtils.defaultIfBlank(request.getQueryString(), "-"));

        Throwable error = null;
        try {
            filterChain.doFilter(request, responseWrapper);
        } catch (IOException | ServletException | RuntimeException ex) {
            error = ex;
            throw ex;
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            String responseCode = StringUtils.defaultIfBlank(extractResponseCode(responseWrapper), "-");
            if (error != null) {
                log.warn("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, outcome=error, errorType={}, errorMessage={}",
                        method, path, responseWrapper.getStatus(), responseCode, costMs,
                        error.getClass().getSimpleName(), StringUtils.abbreviate(error.getMessage(), 200));
            } else if (costMs >= Math.max(properties.getSlowRequestThresholdMs(), 0L)) {
                log.warn("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, outcome=slow",
                        method, path, responseWrapper.getStatus(), responseCode, costMs);
            } else {
                log.info("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, outcome=success",
                        method, path, responseWrapper.getStatus(), responseCode, costMs);
            }
            responseWrapper.copyBodyToResponse();
            MDC.remove(MDC_ZONE_ID);
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private String extractResponseCode(ContentCachingResponseWrapper responseWrapper) {
        byte[] body = responseWrapper.getContentAsByteArray();
        String contentType = responseWrapper.getContentType();
        if (body.length == 0 || StringUtils.isBlank(contentType)
                || !contentType.toLowerCase(Locale.ROOT).contains(MediaType.APPLICATION_JSON_VALUE)) {
            return null;
        }
        try {
            JsonNode code = objectMapper.readTree(body).get("code");
            return code == null || code.isNull() ? null : code.asText();
        } catch (IOException ex) {
            log.debug("HTTP_OUT_BODY_UNPARSEABLE errorMessage={}", ex.getMessage());
            return null;
        }
    }

    private String resolveZoneId(String path) {
        if (!pathMatcher.match(ZONE_PATH_PATTERN, path)) {
            return null;
        }
        return pathMatcher.extractUriTemplateVariables(ZONE_PATH_PATTERN, path).get("zoneId");
    }

    private String headerOrRandom(String value) {
        if (StringUtils.isNotBlank(value)) {
            return value.trim();
        }
        return UUID.randomUUID().toString().replace("-", "");
    }

    private boolean matchesAny(String path, List<String> patterns) {
        if (patterns == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (StringUtils.isNotBlank(pattern) && pathMatcher.match(pattern.trim(), path)) {
                return true;
            }
        }
        return false;
    }

    private String normalizePath(String path) {
        return StringUtils.defaultIfBlank(path, "/").trim();
    }
}
