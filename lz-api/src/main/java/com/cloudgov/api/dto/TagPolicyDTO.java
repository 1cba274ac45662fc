package com.cloudgov.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.List;

/**
 * 标签策略 DTO。inherited / inheritedFrom 仅在解析结果中出现。
 */
@Data
public class TagPolicyDTO {

    private String tagKey;
    private String displayName;
    private Boolean isRequired;
    private List<String> allowedValues;
    private String defaultValue;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Boolean inherited;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String inheritedFrom;
}
