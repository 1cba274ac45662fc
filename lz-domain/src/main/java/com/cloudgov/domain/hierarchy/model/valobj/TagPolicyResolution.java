package com.cloudgov.domain.hierarchy.model.valobj;

import java.util.List;

/**
 * 节点标签策略解析结果：effective = inherited ++ local，两者之间不做按 key 去重。
 */
public record TagPolicyResolution(List<TagPolicyEntry> inherited,
                                  List<TagPolicyEntry> local,
                                  List<TagPolicyEntry> effective) {
}
