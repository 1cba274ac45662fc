package com.cloudgov.domain.hierarchy.model.valobj;

/**
 * 命名模板预览上下文。任一字段为空时由渲染器回落到固定默认值。
 */
public record NamingContext(String providerName,
                            String environment,
                            String typeId,
                            String label,
                            String sequence,
                            String region) {
}
