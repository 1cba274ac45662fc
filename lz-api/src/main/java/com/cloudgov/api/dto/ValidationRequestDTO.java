package com.cloudgov.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 外部校验结果回挂请求 DTO。
 */
@Data
public class ValidationRequestDTO {

    private List<ValidationCheckDTO> checks;
}
