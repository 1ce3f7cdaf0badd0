package com.plugframe.core.resolver;

import com.plugframe.api.exception.InvalidArgumentException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 可比较的版本号
 * <p>
 * 以 "." 或 "-" 分段，数字段按数值比较，非数字段按字典序比较（数字段小于非数字段），
 * 忽略开头的 "v"，缺失的段视为 0。例如 v2 == 2.0.0，1.10 &gt; 1.9。
 */
public final class Version implements Comparable<Version> {

    private final String raw;
    private final List<String> segments;

    private Version(String raw, List<String> segments) {
        this.raw = raw;
        this.segments = segments;
    }

    public static Version parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new InvalidArgumentException("version", "Version cannot be blank");
        }
        String trimmed = text.trim();
        String body = trimmed;
        if (body.length() > 1 && (body.charAt(0) == 'v' || body.charAt(0) == 'V')
                && Character.isDigit(body.charAt(1))) {
            body = body.substring(1);
        }
        List<String> parts = new ArrayList<>();
        for (String part : body.split("[.\\-]")) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        // 去掉末尾的 0 段，保证 2 == 2.0.0
        while (parts.size() > 1 && isZero(parts.get(parts.size() - 1))) {
            parts.remove(parts.size() - 1);
        }
        return new Version(trimmed, Collections.unmodifiableList(parts));
    }

    public boolean isNewerThan(Version other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(Version other) {
        int max = Math.max(segments.size(), other.segments.size());
        for (int i = 0; i < max; i++) {
            String a = i < segments.size() ? segments.get(i) : "0";
            String b = i < other.segments.size() ? other.segments.get(i) : "0";
            int cmp = compareSegment(a, b);
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    private static int compareSegment(String a, String b) {
        boolean aNum = isNumeric(a);
        boolean bNum = isNumeric(b);
        if (aNum && bNum) {
            return new java.math.BigInteger(a).compareTo(new java.math.BigInteger(b));
        }
        if (aNum) {
            return -1;
        }
        if (bNum) {
            return 1;
        }
        return a.compareTo(b);
    }

    private static boolean isNumeric(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return !s.isEmpty();
    }

    private static boolean isZero(String s) {
        return isNumeric(s) && s.chars().allMatch(c -> c == '0');
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Version && compareTo((Version) o) == 0;
    }

    @Override
    public int hashCode() {
        return segments.stream()
                .map(s -> isNumeric(s) ? new java.math.BigInteger(s).toString() : s)
                .reduce(String::concat)
                .orElse("")
                .hashCode();
    }

    @Override
    public String toString() {
        return raw;
    }
}
