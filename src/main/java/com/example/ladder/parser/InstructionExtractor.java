package com.example.ladder.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 从 rung 文本中找出所有 NAME(...) 指令调用，括号按层数配平。
 * <p>
 * 规则：
 * 1. 每个 "标识符(" 作为候选起点，从左括号开始计数，直到层数回到 0；
 * 2. 作为操作数嵌套的调用（如 MOV(ABS(x),y)）属于外层指令，不单独输出；
 * 3. 文本结束时括号仍未闭合的候选直接丢弃，不报错，
 *    扫描从该候选的 "(" 之后继续。
 */
public class InstructionExtractor {

    private static final Logger log = LoggerFactory.getLogger(InstructionExtractor.class);

    private static final Pattern INSTRUCTION_START = Pattern.compile("[A-Za-z0-9_]+\\(");

    public List<String> extract(String text) {
        List<String> out = new ArrayList<>();
        for (InstructionMatch m : findInstructions(text)) {
            out.add(m.getText());
        }
        return out;
    }

    public List<InstructionMatch> findInstructions(String text) {
        List<InstructionMatch> result = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return result;
        }

        Matcher matcher = INSTRUCTION_START.matcher(text);
        int from = 0;
        while (from < text.length() && matcher.find(from)) {
            int start = matcher.start();
            int open = matcher.end() - 1;

            int close = findClosingParen(text, open);
            if (close < 0) {
                // UnbalancedInstructionCall
                log.debug("Dropping unterminated instruction call at offset {}: {}", start, text.substring(start));
                from = matcher.end();
                continue;
            }

            result.add(new InstructionMatch(start, close + 1, text.substring(start, close + 1)));
            from = close + 1;
        }
        return result;
    }

    /**
     * @return 与 open 处 '(' 配对的 ')' 下标；不存在返回 -1
     */
    static int findClosingParen(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
