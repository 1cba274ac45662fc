/**
 * Hierarchy 领域 - Landing Zone 层级设计域
 *
 * <p>职责：云厂商层级约束下的组织树编排、标签策略继承、IPAM 地址规划与节点级校验回挂</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>层级定义：云厂商提供的节点类型、能力与允许的子类型，以及唯一根类型</li>
 *   <li>层级树：扁平节点数组，父子关系只通过 parentId 表达</li>
 *   <li>标签策略：沿祖先链向下继承，近祖先覆盖远祖先的同 key 策略</li>
 * </ul>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.cloudgov.domain.hierarchy.model.aggregate.HierarchyTreeAggregate}</li>
 *   <li>{@link com.cloudgov.domain.hierarchy.model.entity.HierarchyDesignSessionEntity}</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>CidrArithmeticService - CIDR 解析与地址计算</li>
 *   <li>NamingTemplateDomainService - 命名模板预览</li>
 *   <li>TagPolicyResolveDomainService - 标签策略继承解析</li>
 *   <li>HierarchyPlacementDomainService - 层级放置约束</li>
 *   <li>NodeValidationMapperDomainService - 校验结果回挂节点</li>
 *   <li>HierarchyIntegrityDomainService - 层级树完整性校验</li>
 *   <li>HierarchyNodeEditorDomainService - 节点编辑规则</li>
 * </ul>
 */
package com.cloudgov.domain.hierarchy;
