package com.cloudgov.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 完整性校验结果 DTO。
 */
@Data
public class IntegrityCheckResultDTO {

    private List<ValidationCheckDTO> checks;
    private Map<String, List<String>> nodeErrors;
    private boolean hasErrors;
}
