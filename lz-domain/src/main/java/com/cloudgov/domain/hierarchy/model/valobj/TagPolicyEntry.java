package com.cloudgov.domain.hierarchy.model.valobj;

import lombok.Data;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * 标签策略条目。
 * <p>
 * 存储在节点 properties.tagPolicies 中的条目一律视为本地条目；
 * inherited / inheritedFrom 仅在读取时由继承解析填充，不写回存储。
 * </p>
 */
@Data
public class TagPolicyEntry {

    private String tagKey;
    private String displayName;
    private Boolean isRequired;
    private List<String> allowedValues;
    private String defaultValue;

    /** 读取时派生：是否继承自祖先节点 */
    private Boolean inherited;

    /** 读取时派生：提供该策略的祖先节点 label */
    private String inheritedFrom;

    public boolean required() {
        return Boolean.TRUE.equals(isRequired);
    }

    public boolean markedInherited() {
        return Boolean.TRUE.equals(inherited);
    }

    /**
     * 生成一条继承副本，标记来源祖先。
     */
    public TagPolicyEntry inheritedCopy(String ancestorLabel) {
        TagPolicyEntry copy = localCopy();
        copy.setInherited(true);
        copy.setInheritedFrom(ancestorLabel);
        return copy;
    }

    /**
     * 生成去除派生字段的本地副本。
     */
    public TagPolicyEntry localCopy() {
        TagPolicyEntry copy = new TagPolicyEntry();
        copy.setTagKey(tagKey);
        copy.setDisplayName(displayName);
        copy.setIsRequired(required());
        copy.setAllowedValues(allowedValues == null ? null : new ArrayList<>(allowedValues));
        copy.setDefaultValue(defaultValue);
        copy.setInherited(false);
        return copy;
    }

    /**
     * 转换为存储形态，派生字段不落库。
     */
    public Map<String, Object> toStorageMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("tagKey", tagKey);
        map.put("displayName", displayName == null ? tagKey : displayName);
        map.put("isRequired", required());
        if (allowedValues != null && !allowedValues.isEmpty()) {
            map.put("allowedValues", new ArrayList<>(new LinkedHashSet<>(allowedValues)));
        }
        if (defaultValue != null) {
            map.put("defaultValue", defaultValue);
        }
        return map;
    }

    /**
     * 从存储形态（或已是条目对象）解析，无法识别返回 null。
     */
    public static TagPolicyEntry from(Object raw) {
        if (raw instanceof TagPolicyEntry entry) {
            return entry;
        }
        if (!(raw instanceof Map<?, ?> map)) {
            return null;
        }
        String tagKey = text(map.get("tagKey"));
        if (tagKey == null) {
            return null;
        }
        TagPolicyEntry entry = new TagPolicyEntry();
        entry.setTagKey(tagKey);
        entry.setDisplayName(text(map.get("displayName")));
        entry.setIsRequired(bool(map.get("isRequired")));
        entry.setAllowedValues(textList(map.get("allowedValues")));
        entry.setDefaultValue(text(map.get("defaultValue")));
        entry.setInherited(bool(map.get("inherited")));
        entry.setInheritedFrom(text(map.get("inheritedFrom")));
        return entry;
    }

    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    private static Boolean bool(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value != null && "true".equalsIgnoreCase(String.valueOf(value).trim());
    }

    private static List<String> textList(Object value) {
        if (!(value instanceof Collection<?> values)) {
            return null;
        }
        List<String> result = new ArrayList<>();
        for (Object item : values) {
            String text = text(item);
            if (text != null) {
                result.add(text);
            }
        }
        return result;
    }
}
