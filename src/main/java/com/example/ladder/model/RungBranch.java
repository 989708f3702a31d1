package com.example.ladder.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 一个分支（'[' 打开）或分支内的一条并联路径的记录。
 * startPosition / endPosition 是闭区间的 token 下标。
 * <p>
 * equals / hashCode / toString 只看 nestedBranches 的 id，不向下递归；
 * 子记录本身在 BranchRegistry 里各有一条。
 */
@Value
public class RungBranch {

    public static final int UNRESOLVED = -1;

    String branchId;

    /** 父分支 id，顶层分支为 "" */
    String rootBranchId;

    int startPosition;

    int endPosition;

    List<RungBranch> nestedBranches;

    public RungBranch(String branchId,
                      String rootBranchId,
                      int startPosition,
                      int endPosition,
                      List<RungBranch> nestedBranches) {
        this.branchId = branchId;
        this.rootBranchId = rootBranchId;
        this.startPosition = startPosition;
        this.endPosition = endPosition;
        this.nestedBranches = nestedBranches == null ? List.of() : List.copyOf(nestedBranches);
    }

    public boolean isResolved() {
        return endPosition != UNRESOLVED;
    }

    public boolean isTopLevel() {
        return rootBranchId.isEmpty();
    }

    public boolean contains(int position) {
        return isResolved() && startPosition <= position && position <= endPosition;
    }

    public int span() {
        return endPosition - startPosition;
    }

    /** 分支内的并联路径（id 为 {父分支id}:{level}），而不是 '[' 打开的分支 */
    public boolean isPath() {
        return !rootBranchId.isEmpty() && branchId.startsWith(rootBranchId + ":");
    }

    public List<String> nestedBranchIds() {
        List<String> ids = new ArrayList<>(nestedBranches.size());
        for (RungBranch b : nestedBranches) {
            ids.add(b.getBranchId());
        }
        return ids;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RungBranch)) return false;
        RungBranch other = (RungBranch) o;
        return startPosition == other.startPosition
                && endPosition == other.endPosition
                && branchId.equals(other.branchId)
                && rootBranchId.equals(other.rootBranchId)
                && nestedBranchIds().equals(other.nestedBranchIds());
    }

    @Override
    public int hashCode() {
        return Objects.hash(branchId, rootBranchId, startPosition, endPosition, nestedBranchIds());
    }

    @Override
    public String toString() {
        return "RungBranch(" + branchId + ", root=" + rootBranchId
                + ", " + startPosition + ".." + endPosition + ", nested=" + nestedBranchIds() + ")";
    }
}
