package com.cloudgov.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 落库结果 DTO。
 */
@Data
public class FlushResultDTO {

    private String zoneId;
    private Long revision;
    private Integer nodeCount;
    private LocalDateTime flushedAt;
}
