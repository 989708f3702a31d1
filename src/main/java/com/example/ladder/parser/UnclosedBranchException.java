package com.example.ladder.parser;

import lombok.Getter;

/** token 流结束时仍有分支没有 ']'，position 为该分支 '[' 的位置 */
@Getter
public class UnclosedBranchException extends RungParseException {

    private final String branchId;

    public UnclosedBranchException(int position, String branchId) {
        super("Branch '" + branchId + "' opened at position " + position + " is never closed", position, "[");
        this.branchId = branchId;
    }
}
