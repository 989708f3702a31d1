package com.example.ladder.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Tokenizer 输出的单个 token。
 * 结构性 token 的 text 固定为对应的分隔符。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Token {

    private static final Token BRANCH_START = new Token(TokenType.BRANCH_START, "[");
    private static final Token BRANCH_END = new Token(TokenType.BRANCH_END, "]");
    private static final Token BRANCH_NEXT = new Token(TokenType.BRANCH_NEXT, ",");

    TokenType type;
    String text;

    public static Token instruction(String text) {
        return new Token(TokenType.INSTRUCTION, text == null ? "" : text);
    }

    public static Token branchStart() {
        return BRANCH_START;
    }

    public static Token branchEnd() {
        return BRANCH_END;
    }

    public static Token branchNext() {
        return BRANCH_NEXT;
    }

    /**
     * "[" / "]" / "," 映射为结构 token，其余一律视为指令文本。
     */
    public static Token of(String raw) {
        if ("[".equals(raw)) return BRANCH_START;
        if ("]".equals(raw)) return BRANCH_END;
        if (",".equals(raw)) return BRANCH_NEXT;
        return instruction(raw);
    }

    @Override
    public String toString() {
        return text;
    }
}
