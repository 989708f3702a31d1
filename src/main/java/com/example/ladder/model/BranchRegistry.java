package com.example.ladder.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * branchId -> RungBranch 的只读索引，按分支打开的先后顺序保存。
 * 由 SequenceBuilder 在一次解析结束时生成。
 */
public final class BranchRegistry {

    private static final BranchRegistry EMPTY = new BranchRegistry(Map.of());

    private final Map<String, RungBranch> byId;

    private BranchRegistry(Map<String, RungBranch> byId) {
        this.byId = byId;
    }

    public static BranchRegistry empty() {
        return EMPTY;
    }

    public static BranchRegistry of(Collection<RungBranch> branches) {
        Map<String, RungBranch> map = new LinkedHashMap<>();
        for (RungBranch b : branches) {
            if (map.putIfAbsent(b.getBranchId(), b) != null) {
                throw new IllegalArgumentException("Duplicate branch id: " + b.getBranchId());
            }
        }
        return new BranchRegistry(Collections.unmodifiableMap(map));
    }

    public Optional<RungBranch> get(String branchId) {
        return Optional.ofNullable(byId.get(branchId));
    }

    public boolean contains(String branchId) {
        return byId.containsKey(branchId);
    }

    public int size() {
        return byId.size();
    }

    public boolean isEmpty() {
        return byId.isEmpty();
    }

    public Set<String> ids() {
        return byId.keySet();
    }

    public Collection<RungBranch> branches() {
        return byId.values();
    }

    public Map<String, RungBranch> asMap() {
        return byId;
    }

    public List<RungBranch> topLevelBranches() {
        List<RungBranch> out = new ArrayList<>();
        for (RungBranch b : byId.values()) {
            if (b.isTopLevel()) out.add(b);
        }
        return out;
    }

    /**
     * 包含 position 的最内层记录（跨度最小者）；同跨度时取后打开的那个。
     * 结果可能是并联路径：分支的第一条路径从它自己的 '[' 开始，
     * 所以对 '[' 的位置返回的是 {分支id}:{level} 这条路径。
     * 只要 '[' 打开的分支用 {@link #findEnclosingBranch(int)}。
     */
    public Optional<RungBranch> findEnclosing(int position) {
        return findInnermost(position, false);
    }

    /**
     * 包含 position 的最内层 '[' .. ']' 分支，忽略并联路径记录。
     */
    public Optional<RungBranch> findEnclosingBranch(int position) {
        return findInnermost(position, true);
    }

    private Optional<RungBranch> findInnermost(int position, boolean branchesOnly) {
        RungBranch best = null;
        for (RungBranch b : byId.values()) {
            if (!b.contains(position)) continue;
            if (branchesOnly && b.isPath()) continue;
            if (best == null || b.span() <= best.span()) {
                best = b;
            }
        }
        return Optional.ofNullable(best);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BranchRegistry)) return false;
        return byId.equals(((BranchRegistry) o).byId);
    }

    @Override
    public int hashCode() {
        return byId.hashCode();
    }

    @Override
    public String toString() {
        return "BranchRegistry" + byId.keySet();
    }
}
