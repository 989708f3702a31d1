package com.example.ladder.parser;

import com.example.ladder.model.RungBranch;

import java.util.ArrayList;
import java.util.List;

/**
 * SequenceBuilder 解析过程中的可变分支记录，解析结束后冻结成 RungBranch。
 */
final class BranchNode {
    final String id;
    final String rootId;
    final int start;
    int end = RungBranch.UNRESOLVED;

    /** 分支节点下是并联路径；路径节点下是路径内打开的子分支 */
    final List<BranchNode> nested = new ArrayList<>(2);

    BranchNode(String id, String rootId, int start) {
        this.id = id;
        this.rootId = rootId;
        this.start = start;
    }

    BranchNode lastNested() {
        return nested.isEmpty() ? null : nested.get(nested.size() - 1);
    }
}
