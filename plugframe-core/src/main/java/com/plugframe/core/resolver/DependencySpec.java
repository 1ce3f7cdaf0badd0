package com.plugframe.core.resolver;

import com.plugframe.api.exception.InvalidArgumentException;
import lombok.Value;

import java.util.regex.Pattern;

/**
 * 依赖声明
 * 格式：name[op version]，op 取 &gt;=, &lt;=, ==, &gt;, &lt;
 */
@Value
public class DependencySpec {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9_.-]+$");

    String name;
    String operator;
    Version required;

    public static DependencySpec parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new InvalidArgumentException("dependency", "Dependency cannot be blank");
        }
        String trimmed = text.trim();
        int opStart = indexOfOperator(trimmed);
        if (opStart < 0) {
            return new DependencySpec(checkName(trimmed, text), null, null);
        }
        String name = checkName(trimmed.substring(0, opStart).trim(), text);
        String rest = trimmed.substring(opStart);
        String op = rest.length() > 1 && rest.charAt(1) == '=' ? rest.substring(0, 2) : rest.substring(0, 1);
        if ("=".equals(op)) {
            throw new InvalidArgumentException("dependency", "Invalid version constraint: " + text);
        }
        String version = rest.substring(op.length()).trim();
        if (version.isEmpty() || indexOfOperator(version) >= 0) {
            throw new InvalidArgumentException("dependency", "Invalid version constraint: " + text);
        }
        return new DependencySpec(name, op, Version.parse(version));
    }

    private static int indexOfOperator(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '<' || c == '>' || c == '=') {
                return i;
            }
        }
        return -1;
    }

    private static String checkName(String name, String original) {
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new InvalidArgumentException("dependency", "Invalid dependency: " + original);
        }
        return name;
    }

    public boolean hasConstraint() {
        return operator != null;
    }

    /**
     * 检查给定版本是否满足约束
     */
    public boolean isSatisfiedBy(String version) {
        if (!hasConstraint()) {
            return true;
        }
        int cmp = Version.parse(version).compareTo(required);
        switch (operator) {
            case "==":
                return cmp == 0;
            case ">=":
                return cmp >= 0;
            case "<=":
                return cmp <= 0;
            case ">":
                return cmp > 0;
            case "<":
                return cmp < 0;
            default:
                return true;
        }
    }

    @Override
    public String toString() {
        return hasConstraint() ? name + operator + required : name;
    }
}
