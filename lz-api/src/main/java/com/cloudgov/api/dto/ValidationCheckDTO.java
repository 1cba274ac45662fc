package com.cloudgov.api.dto;

import lombok.Data;

/**
 * 单条校验结果 DTO，status 取 error / warning / ok。
 */
@Data
public class ValidationCheckDTO {

    private String key;
    private String label;
    private String status;
    private String message;
}
