package com.cloudgov.api.dto;

import lombok.Data;

/**
 * 添加层级节点请求 DTO。
 */
@Data
public class NodeAddRequestDTO {

    private String typeId;
}
