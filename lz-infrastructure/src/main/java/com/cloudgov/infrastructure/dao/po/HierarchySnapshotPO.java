package com.cloudgov.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 层级树快照 PO，序列化形态为 {"nodes": [...]}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HierarchySnapshotPO {

    private List<HierarchyNodePO> nodes;
}
