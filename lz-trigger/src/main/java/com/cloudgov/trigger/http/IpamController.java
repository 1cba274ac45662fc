package com.cloudgov.trigger.http;

import com.cloudgov.api.dto.CidrInfoDTO;
import com.cloudgov.api.response.Response;
import com.cloudgov.trigger.application.query.HierarchyDesignQueryService;
import com.cloudgov.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 无状态 CIDR 解析 API。无效输入返回 valid=false，不作为错误处理。
 */
@RestController
@RequestMapping("/api/ipam")
public class IpamController {

    private final HierarchyDesignQueryService hierarchyDesignQueryService;

    public IpamController(HierarchyDesignQueryService hierarchyDesignQueryService) {
        this.hierarchyDesignQueryService = hierarchyDesignQueryService;
    }

    @GetMapping("/cidr")
    public Response<CidrInfoDTO> parseCidr(@RequestParam(value = "value", required = false) String value) {
        return Response.<CidrInfoDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(hierarchyDesignQueryService.parseCidr(value))
                .build();
    }
}
