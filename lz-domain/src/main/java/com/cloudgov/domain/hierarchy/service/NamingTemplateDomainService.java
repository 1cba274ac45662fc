package com.cloudgov.domain.hierarchy.service;

import com.cloudgov.domain.hierarchy.model.valobj.NamingContext;
import org.springframework.stereotype.Service;

/**
 * 命名模板预览领域服务：固定占位符的字面替换，仅用于预览，不改变存储。
 */
@Service
public class NamingTemplateDomainService {

    public static final String DEFAULT_PROVIDER = "oci";
    public static final String DEFAULT_ENVIRONMENT = "dev";
    public static final String DEFAULT_TYPE = "node";
    public static final String DEFAULT_NAME = "example";
    public static final String DEFAULT_SEQUENCE = "001";
    public static final String DEFAULT_REGION = "us-east-1";

    /**
     * 渲染预览。未识别的占位符原样保留。
     *
     * @param template 命名模板，为空时返回空串
     * @param context 预览上下文
     * @return 替换后的预览字符串
     */
    public String render(String template, NamingContext context) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        NamingContext source = context == null ? new NamingContext(null, null, null, null, null, null) : context;
        return template
                .replace("{{provider}}", defaultIfBlank(source.providerName(), DEFAULT_PROVIDER))
                .replace("{{env}}", defaultIfBlank(source.environment(), DEFAULT_ENVIRONMENT))
                .replace("{{type}}", defaultIfBlank(source.typeId(), DEFAULT_TYPE))
                .replace("{{name}}", slug(defaultIfBlank(source.label(), DEFAULT_NAME)))
                .replace("{{seq}}", defaultIfBlank(source.sequence(), DEFAULT_SEQUENCE))
                .replace("{{region}}", defaultIfBlank(source.region(), DEFAULT_REGION));
    }

    private String slug(String label) {
        return label.toLowerCase().replaceAll("\\s+", "-");
    }

    private String defaultIfBlank(String value, String defaultValue) {
        return value == null || value.trim().isEmpty() ? defaultValue : value;
    }
}
