package com.example.ladder.parser;

import lombok.Getter;

/** 关闭分支时找不到它的并联路径记录 */
@Getter
public class MissingNestedBranchRecordException extends RungParseException {

    private final String branchId;

    public MissingNestedBranchRecordException(int position, String branchId) {
        super("Branch '" + branchId + "' has no nested branches to close at position " + position, position, "]");
        this.branchId = branchId;
    }
}
