package com.cloudgov.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * 节点更新请求 DTO。properties 做顶层浅合并，值为 null 表示删除该键。
 */
@Data
public class NodeUpdateRequestDTO {

    private String label;
    private Map<String, Object> properties;
}
