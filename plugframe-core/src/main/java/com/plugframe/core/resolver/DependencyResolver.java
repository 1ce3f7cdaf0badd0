package com.plugframe.core.resolver;

import com.plugframe.api.config.PluginDefinition;
import com.plugframe.api.exception.CycleDetectedException;
import com.plugframe.api.exception.DuplicatePluginException;
import com.plugframe.api.exception.MissingDependencyException;
import com.plugframe.core.registry.PluginRecord;
import com.plugframe.core.registry.PluginRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;

/**
 * 依赖解析器
 * <p>
 * 依赖图由注册表中 ACTIVE 记录的依赖声明构成，解析器本身不保存状态，
 * 每次调用都基于注册表的当前视图计算。
 */
@Slf4j
@RequiredArgsConstructor
public class DependencyResolver {

    private enum Color { WHITE, GREY, BLACK }

    private final PluginRegistry registry;

    /**
     * 去掉版本约束后的依赖名
     */
    public static Set<String> namesOf(Collection<String> specs) {
        Set<String> names = new LinkedHashSet<>();
        if (specs != null) {
            for (String spec : specs) {
                names.add(DependencySpec.parse(spec).getName());
            }
        }
        return names;
    }

    // ==================== 校验 ====================

    /**
     * 环检测：在 ACTIVE 记录与候选插件的并集上做三色 DFS
     * 同名的 ACTIVE 记录被候选定义替换（重载场景）
     *
     * @throws CycleDetectedException 携带环路径，例如 [a, b, a]
     */
    public void validate(PluginDefinition candidate) {
        Map<String, Set<String>> graph = activeGraph();
        graph.put(candidate.getName(), namesOf(candidate.getDependencies()));
        List<String> cycle = findCycle(graph, Collections.singletonList(candidate.getName()));
        if (cycle != null) {
            log.warn("[{}] Dependency cycle detected: {}", candidate.getName(), cycle);
            throw new CycleDetectedException(cycle);
        }
    }

    /**
     * 完整校验：环 + 缺失依赖
     */
    public void validateAndRequire(PluginDefinition candidate) {
        validate(candidate);
        Set<String> missing = missingDependencies(candidate);
        if (!missing.isEmpty()) {
            throw new MissingDependencyException(candidate.getName(), missing);
        }
    }

    /**
     * 不是 ACTIVE 或版本约束不满足的依赖
     */
    public Set<String> missingDependencies(PluginDefinition definition) {
        return missing(definition.getDependencies());
    }

    public Set<String> missingDependencies(String name) {
        return missing(registry.get(name).getDependencies());
    }

    /**
     * 已不在服务中（缺失、FAILED、SUSPENDED）或版本约束不满足的依赖
     * 正在重载或回滚的依赖视为可用，重载提交时用
     */
    public Set<String> unavailableDependencies(PluginDefinition definition) {
        return missing(definition.getDependencies(), true);
    }

    public Set<String> unavailableDependencies(String name) {
        return missing(registry.get(name).getDependencies(), true);
    }

    private Set<String> missing(Collection<String> dependencies) {
        return missing(dependencies, false);
    }

    private Set<String> missing(Collection<String> dependencies, boolean acceptLive) {
        Set<String> missing = new LinkedHashSet<>();
        if (dependencies == null) {
            return missing;
        }
        for (String raw : dependencies) {
            DependencySpec spec = DependencySpec.parse(raw);
            Optional<PluginRecord> dep = registry.find(spec.getName());
            boolean serving = dep.isPresent()
                    && (acceptLive ? dep.get().getStatus().isLive() : dep.get().isActive());
            if (!serving || !spec.isSatisfiedBy(dep.get().getVersion())) {
                missing.add(spec.toString());
            }
        }
        return missing;
    }

    // ==================== 影响分析 ====================

    /**
     * 重载 name 的影响范围：只重载 name 本身，ACTIVE 依赖方（直接与传递）需要重新校验
     */
    public ReloadPlan affectedClosure(String name) {
        return new ReloadPlan(name, transitiveDependents(name));
    }

    /**
     * 直接依赖 name 的 ACTIVE 插件（按注册顺序）
     */
    public List<String> activeDependents(String name) {
        List<String> result = new ArrayList<>();
        for (PluginRecord record : registry.list()) {
            if (record.isActive() && record.dependencyNames().contains(name)) {
                result.add(record.getName());
            }
        }
        return result;
    }

    /**
     * 直接依赖 name 且仍在服务中的插件（ACTIVE 或重载中），卸载前检查用
     */
    public List<String> liveDependents(String name) {
        List<String> result = new ArrayList<>();
        for (PluginRecord record : registry.list()) {
            if (record.getStatus().isLive() && record.dependencyNames().contains(name)) {
                result.add(record.getName());
            }
        }
        return result;
    }

    /**
     * 直接或传递依赖 name 的 ACTIVE 插件（广度优先）
     */
    public List<String> transitiveDependents(String name) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(name);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String dependent : activeDependents(current)) {
                if (!dependent.equals(name) && visited.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }
        return new ArrayList<>(visited);
    }

    /**
     * ACTIVE 依赖方对 name 要求的能力并集
     */
    public Set<String> requiredCapabilities(String name) {
        Set<String> required = new TreeSet<>();
        for (PluginRecord record : registry.list()) {
            if (record.isActive() && record.dependencyNames().contains(name)) {
                Set<String> caps = record.getRequiredCapabilities().get(name);
                if (caps != null) {
                    required.addAll(caps);
                }
            }
        }
        return required;
    }

    // ==================== 排序与展示 ====================

    /**
     * 批量安装顺序：Kahn 拓扑排序，同层按名称字典序
     * 批次之外的依赖不参与排序（安装时再校验）
     */
    public List<PluginDefinition> installOrder(Collection<PluginDefinition> definitions) {
        Map<String, PluginDefinition> byName = new LinkedHashMap<>();
        for (PluginDefinition definition : definitions) {
            if (byName.put(definition.getName(), definition) != null) {
                throw new DuplicatePluginException(definition.getName());
            }
        }

        Map<String, Set<String>> graph = new HashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (PluginDefinition definition : byName.values()) {
            Set<String> deps = new LinkedHashSet<>(namesOf(definition.getDependencies()));
            deps.retainAll(byName.keySet());
            graph.put(definition.getName(), deps);
            inDegree.put(definition.getName(), deps.size());
            for (String dep : deps) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(definition.getName());
            }
        }

        PriorityQueue<String> ready = new PriorityQueue<>();
        inDegree.forEach((name, degree) -> {
            if (degree == 0) {
                ready.add(name);
            }
        });

        List<PluginDefinition> ordered = new ArrayList<>();
        while (!ready.isEmpty()) {
            String name = ready.poll();
            ordered.add(byName.get(name));
            for (String dependent : dependents.getOrDefault(name, Collections.emptyList())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (ordered.size() < byName.size()) {
            List<String> remaining = new ArrayList<>(new TreeSet<>(byName.keySet()));
            ordered.forEach(d -> remaining.remove(d.getName()));
            List<String> cycle = findCycle(graph, remaining);
            throw new CycleDetectedException(cycle != null ? cycle : remaining);
        }
        return ordered;
    }

    /**
     * 依赖树：name -&gt; 直接依赖名，包含所有传递依赖
     */
    public Map<String, List<String>> dependencyTree(String name) {
        registry.get(name);
        Map<String, List<String>> tree = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(name);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (tree.containsKey(current)) {
                continue;
            }
            List<String> deps = registry.find(current)
                    .map(r -> new ArrayList<>(r.dependencyNames()))
                    .orElseGet(ArrayList::new);
            tree.put(current, deps);
            queue.addAll(deps);
        }
        return tree;
    }

    // ==================== 内部 ====================

    private Map<String, Set<String>> activeGraph() {
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        for (PluginRecord record : registry.list()) {
            if (record.isActive()) {
                graph.put(record.getName(), record.dependencyNames());
            }
        }
        return graph;
    }

    /**
     * 从给定起点做三色 DFS，返回第一个环（首尾相同），无环返回 null
     */
    private List<String> findCycle(Map<String, Set<String>> graph, Collection<String> roots) {
        Map<String, Color> colors = new HashMap<>();
        for (String root : roots) {
            Deque<String> path = new ArrayDeque<>();
            List<String> cycle = visit(root, graph, colors, path);
            if (cycle != null) {
                return cycle;
            }
        }
        return null;
    }

    private List<String> visit(String node, Map<String, Set<String>> graph, Map<String, Color> colors,
                               Deque<String> path) {
        Color color = colors.getOrDefault(node, Color.WHITE);
        if (color == Color.BLACK) {
            return null;
        }
        if (color == Color.GREY) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (String p : path) {
                if (p.equals(node)) {
                    inCycle = true;
                }
                if (inCycle) {
                    cycle.add(p);
                }
            }
            cycle.add(node);
            return cycle;
        }
        colors.put(node, Color.GREY);
        path.addLast(node);
        for (String next : graph.getOrDefault(node, Collections.emptySet())) {
            List<String> cycle = visit(next, graph, colors, path);
            if (cycle != null) {
                return cycle;
            }
        }
        path.removeLast();
        colors.put(node, Color.BLACK);
        return null;
    }
}
