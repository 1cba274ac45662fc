package com.cloudgov.api.dto;

import lombok.Data;

/**
 * 层级面板项 DTO。
 */
@Data
public class PlacementOptionDTO {

    private String typeId;
    private String label;
    private String icon;
    private boolean placeable;
    private String hint;
}
