package com.cloudgov.trigger.http;

import com.cloudgov.api.dto.ProviderHierarchyDTO;
import com.cloudgov.api.response.Response;
import com.cloudgov.trigger.application.query.HierarchyDesignQueryService;
import com.cloudgov.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 云厂商层级定义查询 API。
 */
@RestController
@RequestMapping("/api/providers")
public class ProviderHierarchyController {

    private final HierarchyDesignQueryService hierarchyDesignQueryService;

    public ProviderHierarchyController(HierarchyDesignQueryService hierarchyDesignQueryService) {
        this.hierarchyDesignQueryService = hierarchyDesignQueryService;
    }

    @GetMapping
    public Response<List<ProviderHierarchyDTO>> listProviders() {
        return Response.<List<ProviderHierarchyDTO>>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(hierarchyDesignQueryService.listProviders())
                .build();
    }

    @GetMapping("/{provider}/hierarchy")
    public Response<ProviderHierarchyDTO> getHierarchy(@PathVariable("provider") String provider) {
        return Response.<ProviderHierarchyDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(hierarchyDesignQueryService.getProvider(provider))
                .build();
    }
}
