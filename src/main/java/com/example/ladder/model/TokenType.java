package com.example.ladder.model;

/**
 * 梯形图 rung 文本的词法单元种类：
 *  - INSTRUCTION  : NAME(...) 指令调用
 *  - BRANCH_START : '['
 *  - BRANCH_END   : ']'
 *  - BRANCH_NEXT  : ','
 */
public enum TokenType {
    INSTRUCTION(null),
    BRANCH_START("["),
    BRANCH_END("]"),
    BRANCH_NEXT(",");

    private final String symbol;

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    /** structural delimiter text, null for INSTRUCTION */
    public String symbol() {
        return symbol;
    }

    public boolean isStructural() {
        return symbol != null;
    }
}
