package com.cloudgov.domain.hierarchy.model.valobj;

import com.cloudgov.types.enums.ValidationStatusEnum;

/**
 * 单条校验结果。key 中包含 node:&lt;nodeId&gt; 时可回挂到具体节点。
 */
public record ValidationCheck(String key,
                              String label,
                              ValidationStatusEnum status,
                              String message) {

    public boolean isError() {
        return status == ValidationStatusEnum.ERROR;
    }
}
