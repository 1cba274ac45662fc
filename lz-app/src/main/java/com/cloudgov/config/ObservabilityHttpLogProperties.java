package com.cloudgov.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * HTTP 入口日志配置。
 */
@Data
@Component
@ConfigurationProperties(prefix = "observability.http-log", ignoreInvalidFields = true)
public class ObservabilityHttpLogProperties {

    /** 是否启用 HTTP 入口日志。 */
    private boolean enabled = true;

    /** 需要记录日志的路径模式。 */
    private List<String> includePathPatterns = Arrays.asList("/api/**");

    /** 需要排除日志的路径模式。 */
    private List<String> excludePathPatterns = Arrays.asList("/actuator/**");

    /** 慢请求阈值，超过时 HTTP_OUT 以 WARN 输出。 */
    private long slowRequestThresholdMs = 1000L;
}
