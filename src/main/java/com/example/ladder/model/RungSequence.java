package com.example.ladder.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次解析的结果：按位置排好的元素序列 + 分支索引。
 */
@Value
public class RungSequence {

    List<RungElement> elements;

    BranchRegistry branches;

    public RungSequence(List<RungElement> elements, BranchRegistry branches) {
        this.elements = List.copyOf(elements);
        this.branches = branches == null ? BranchRegistry.empty() : branches;
    }

    public int size() {
        return elements.size();
    }

    public RungElement get(int position) {
        return elements.get(position);
    }

    public List<String> instructions() {
        List<String> out = new ArrayList<>();
        for (RungElement e : elements) {
            if (e.hasInstruction()) out.add(e.getInstruction());
        }
        return out;
    }
}
