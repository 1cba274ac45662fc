package com.cloudgov.api.dto;

import lombok.Data;

/**
 * 选中节点请求 DTO，nodeId 为空表示取消选中。
 */
@Data
public class NodeSelectionRequestDTO {

    private String nodeId;
}
