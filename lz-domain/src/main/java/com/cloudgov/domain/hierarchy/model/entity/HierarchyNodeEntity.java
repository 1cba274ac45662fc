package com.cloudgov.domain.hierarchy.model.entity;

import com.cloudgov.domain.hierarchy.model.valobj.TagPolicyEntry;
import com.cloudgov.types.common.Constants;
import lombok.Data;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 层级节点领域实体。
 * <p>
 * 树结构只通过 parentId 表达，不持有子节点引用。properties 为开放结构，
 * 约定键见 {@link Constants} 中的 PROP_*。
 * </p>
 */
@Data
public class HierarchyNodeEntity {

    /**
     * 节点 ID（不透明唯一标识）
     */
    private String id;

    /**
     * 父节点 ID，根节点为空
     */
    private String parentId;

    /**
     * 层级类型标识，必须在当前云厂商层级中声明
     */
    private String typeId;

    /**
     * 节点名称
     */
    private String label;

    /**
     * 节点属性
     */
    private Map<String, Object> properties = new LinkedHashMap<>();

    public boolean isRoot() {
        return parentId == null || parentId.trim().isEmpty();
    }

    /**
     * 读取 ipam.cidr 原始字符串（可能无效），缺省返回 null。
     */
    public String readCidr() {
        return readNestedText(Constants.PROP_IPAM, Constants.PROP_IPAM_CIDR);
    }

    /**
     * 读取 namingConfig.template，缺省返回 null。
     */
    public String readNamingTemplate() {
        return readNestedText(Constants.PROP_NAMING_CONFIG, Constants.PROP_NAMING_TEMPLATE);
    }

    /**
     * 读取环境标识原始值，缺省返回 null。
     */
    public String readEnvironmentDesignation() {
        Object value = properties == null ? null : properties.get(Constants.PROP_ENVIRONMENT);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * 读取存储中的全部标签策略条目（按存储顺序，跳过无法识别的条目）。
     */
    public List<TagPolicyEntry> readTagPolicies() {
        List<TagPolicyEntry> entries = new ArrayList<>();
        Object raw = properties == null ? null : properties.get(Constants.PROP_TAG_POLICIES);
        if (!(raw instanceof Collection<?> items)) {
            return entries;
        }
        for (Object item : items) {
            TagPolicyEntry entry = TagPolicyEntry.from(item);
            if (entry != null) {
                entries.add(entry);
            }
        }
        return entries;
    }

    /**
     * 以本地形态写回标签策略，派生字段被剥离。
     */
    public void writeTagPolicies(List<TagPolicyEntry> entries) {
        List<Map<String, Object>> stored = new ArrayList<>();
        if (entries != null) {
            for (TagPolicyEntry entry : entries) {
                stored.add(entry.toStorageMap());
            }
        }
        ensureProperties().put(Constants.PROP_TAG_POLICIES, stored);
    }

    /**
     * 剔除 tagPolicies 中带继承标记的条目，其余条目以本地形态写回；无 tagPolicies 时不做任何修改。
     */
    public void dropInheritedTagPolicies() {
        if (properties == null || !(properties.get(Constants.PROP_TAG_POLICIES) instanceof Collection<?>)) {
            return;
        }
        writeTagPolicies(toLocalEntries(properties.get(Constants.PROP_TAG_POLICIES)));
    }

    /**
     * 合并属性：顶层浅合并；双方都是 Map 的键做一层嵌套合并；值为 null 表示删除该键。
     */
    public void mergeProperties(Map<String, Object> partial) {
        if (partial == null || partial.isEmpty()) {
            return;
        }
        Map<String, Object> target = ensureProperties();
        for (Map.Entry<String, Object> entry : partial.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (key == null) {
                continue;
            }
            if (value == null) {
                target.remove(key);
                continue;
            }
            if (Constants.PROP_TAG_POLICIES.equals(key)) {
                writeTagPolicies(toLocalEntries(value));
                continue;
            }
            Object existing = target.get(key);
            if (value instanceof Map<?, ?> incoming && existing instanceof Map<?, ?> current) {
                Map<String, Object> merged = copyMap(current);
                for (Map.Entry<?, ?> nested : incoming.entrySet()) {
                    if (nested.getKey() == null) {
                        continue;
                    }
                    if (nested.getValue() == null) {
                        merged.remove(String.valueOf(nested.getKey()));
                    } else {
                        merged.put(String.valueOf(nested.getKey()), nested.getValue());
                    }
                }
                target.put(key, merged);
            } else if (value instanceof Map<?, ?> incoming) {
                target.put(key, copyMap(incoming));
            } else {
                target.put(key, value);
            }
        }
    }

    /**
     * 写入或清除一个嵌套文本属性，如 ipam.cidr。
     */
    public void writeNestedText(String section, String key, String value) {
        Map<String, Object> target = ensureProperties();
        Object existing = target.get(section);
        Map<String, Object> nested = existing instanceof Map<?, ?> current ? copyMap(current) : new LinkedHashMap<>();
        if (value == null) {
            nested.remove(key);
        } else {
            nested.put(key, value);
        }
        if (nested.isEmpty()) {
            target.remove(section);
        } else {
            target.put(section, nested);
        }
    }

    /**
     * 复制节点；properties 中的 Map / List 逐层复制，避免快照与会话之间共享可变结构。
     */
    public HierarchyNodeEntity copy() {
        HierarchyNodeEntity copy = new HierarchyNodeEntity();
        copy.setId(id);
        copy.setParentId(parentId);
        copy.setTypeId(typeId);
        copy.setLabel(label);
        copy.setProperties(properties == null ? new LinkedHashMap<>() : copyMap(properties));
        return copy;
    }

    private String readNestedText(String section, String key) {
        Object nested = properties == null ? null : properties.get(section);
        if (!(nested instanceof Map<?, ?> map)) {
            return null;
        }
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value);
        return text.trim().isEmpty() ? null : text;
    }

    private Map<String, Object> ensureProperties() {
        if (properties == null) {
            properties = new LinkedHashMap<>();
        }
        return properties;
    }

    private static List<TagPolicyEntry> toLocalEntries(Object value) {
        List<TagPolicyEntry> entries = new ArrayList<>();
        if (!(value instanceof Collection<?> items)) {
            return entries;
        }
        for (Object item : items) {
            TagPolicyEntry entry = TagPolicyEntry.from(item);
            // 继承条目由读取时解析得出，回传的不落到本节点
            if (entry != null && !entry.markedInherited()) {
                entries.add(entry.localCopy());
            }
        }
        return entries;
    }

    private static Map<String, Object> copyMap(Map<?, ?> source) {
        Map<String, Object> copied = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            if (entry.getKey() == null) {
                continue;
            }
            copied.put(String.valueOf(entry.getKey()), copyValue(entry.getValue()));
        }
        return copied;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyMap(map);
        }
        if (value instanceof Collection<?> items) {
            List<Object> copied = new ArrayList<>();
            for (Object item : items) {
                copied.add(copyValue(item));
            }
            return copied;
        }
        if (value instanceof TagPolicyEntry entry) {
            return entry.toStorageMap();
        }
        return value;
    }
}
