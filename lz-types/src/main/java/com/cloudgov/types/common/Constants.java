package com.cloudgov.types.common;

/**
 * 全局常量定义类。
 */
public class Constants {

    /** 校验项 key 中节点作用域的前缀，形如 node:&lt;nodeId&gt; */
    public final static String NODE_KEY_PREFIX = "node:";

    /** 节点属性：IPAM 配置（嵌套 cidr） */
    public final static String PROP_IPAM = "ipam";

    /** 节点属性：IPAM 中的 CIDR */
    public final static String PROP_IPAM_CIDR = "cidr";

    /** 节点属性：命名配置（嵌套 template） */
    public final static String PROP_NAMING_CONFIG = "namingConfig";

    /** 节点属性：命名模板 */
    public final static String PROP_NAMING_TEMPLATE = "template";

    /** 节点属性：环境标识 */
    public final static String PROP_ENVIRONMENT = "environmentDesignation";

    /** 节点属性：本地标签策略列表 */
    public final static String PROP_TAG_POLICIES = "tagPolicies";

}
