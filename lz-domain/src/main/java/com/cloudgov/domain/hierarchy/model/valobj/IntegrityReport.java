package com.cloudgov.domain.hierarchy.model.valobj;

import java.util.List;
import java.util.Map;

/**
 * 完整性校验结果：全部校验项 + 按节点归类的消息。
 */
public record IntegrityReport(List<ValidationCheck> checks,
                              Map<String, List<String>> nodeErrors,
                              boolean hasErrors) {
}
