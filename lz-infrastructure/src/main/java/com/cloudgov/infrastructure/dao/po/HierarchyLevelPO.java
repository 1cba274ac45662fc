package com.cloudgov.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 层级定义 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HierarchyLevelPO {

    private String typeId;
    private String label;
    private String icon;
    private List<String> allowedChildren;
    private Boolean supportsTags;
    private Boolean supportsIpam;
    private Boolean supportsEnvironment;
}
