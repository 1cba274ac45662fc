package com.cloudgov.domain.hierarchy.service;

import com.cloudgov.domain.hierarchy.model.valobj.ValidationCheck;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 校验结果回挂领域服务：从 key 中提取 node:&lt;nodeId&gt;，把 error / warning 消息按出现顺序归到节点。
 * <p>
 * 不解释消息内容，也不执行任何规则；key 不含节点作用域的校验项被丢弃。
 * </p>
 */
@Service
public class NodeValidationMapperDomainService {

    // 不限定 UUID：蓝图与后端重新同步的节点 ID 可能含大写字母与下划线
    private static final Pattern NODE_KEY_PATTERN = Pattern.compile("node:([A-Za-z0-9][A-Za-z0-9_-]*)");

    public Map<String, List<String>> mapToNodes(List<ValidationCheck> checks) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        if (checks == null || checks.isEmpty()) {
            return errors;
        }
        for (ValidationCheck check : checks) {
            if (check == null || check.status() == null || !check.status().isProblem()) {
                continue;
            }
            String nodeId = extractNodeId(check.key());
            if (nodeId == null) {
                continue;
            }
            errors.computeIfAbsent(nodeId, key -> new ArrayList<>()).add(check.message());
        }
        return errors;
    }

    /**
     * 提取 key 中第一个 node:&lt;id&gt; 的 id，不匹配返回 null。
     */
    public String extractNodeId(String key) {
        if (key == null || key.isEmpty()) {
            return null;
        }
        Matcher matcher = NODE_KEY_PATTERN.matcher(key);
        return matcher.find() ? matcher.group(1) : null;
    }
}
