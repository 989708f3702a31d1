package com.example.ladder.parser;

/** ',' 出现时栈上没有打开的分支 */
public class MalformedBranchContinuationException extends RungParseException {

    public MalformedBranchContinuationException(int position) {
        super("Next-branch marker found without an active branch at position " + position, position, ",");
    }
}
