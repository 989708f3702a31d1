package com.example.ladder.parser;

/** ']' 出现时栈上没有打开的分支 */
public class MalformedBranchEndException extends RungParseException {

    public MalformedBranchEndException(int position) {
        super("Branch end found without an active branch at position " + position, position, "]");
    }
}
