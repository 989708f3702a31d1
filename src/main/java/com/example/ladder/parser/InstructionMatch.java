package com.example.ladder.parser;

import lombok.Value;

/**
 * 文本中一条完整的指令调用，[start, end) 为其在原文中的范围。
 */
@Value
public class InstructionMatch {
    int start;
    int end;
    String text;

    public boolean covers(int index) {
        return start <= index && index < end;
    }
}
