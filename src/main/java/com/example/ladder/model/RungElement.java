package com.example.ladder.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * rung 序列中的一个元素，每个 token 对应一个。
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RungElement {

    RungElementType elementType;

    /** 只有 INSTRUCTION 元素才有，其余为 null */
    String instruction;

    /** 元素所在最内层作用域的 id，顶层为 "" */
    String branchId;

    /** 最近一个包围它的 BranchStart 的 id，顶层为 "" */
    String rootBranchId;

    int branchLevel;

    int position;

    public boolean hasInstruction() {
        return elementType == RungElementType.INSTRUCTION;
    }

    @JsonIgnore
    public boolean isTopLevel() {
        return rootBranchId.isEmpty();
    }
}
