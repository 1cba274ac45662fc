package com.cloudgov.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 设计会话缓存配置。
 */
@Data
@Component
@ConfigurationProperties(prefix = "designer.session", ignoreInvalidFields = true)
public class DesignerSessionProperties {

    /** 会话空闲多久后被淘汰（分钟）。 */
    private long expireAfterAccessMinutes = 120L;

    /** 同时保留的会话上限。 */
    private long maximumSize = 500L;
}
