package com.example.ladder.parser;

import com.example.ladder.model.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * 把 rung 文本切成 token 流：指令 + 指令外部的 '[' ']' ','。
 * 指令括号内部的分隔符（数组下标、参数逗号）不算结构 token，
 * 其余字符（空白、';' 等）丢弃。
 */
public class RungTokenizer {

    private final InstructionExtractor extractor;

    public RungTokenizer() {
        this(new InstructionExtractor());
    }

    public RungTokenizer(InstructionExtractor extractor) {
        this.extractor = extractor;
    }

    public List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }

        List<InstructionMatch> matches = extractor.findInstructions(text);
        int next = 0;
        int i = 0;
        while (i < text.length()) {
            if (next < matches.size() && matches.get(next).getStart() == i) {
                InstructionMatch m = matches.get(next++);
                tokens.add(Token.instruction(m.getText()));
                i = m.getEnd();
                continue;
            }

            switch (text.charAt(i)) {
                case '[':
                    tokens.add(Token.branchStart());
                    break;
                case ']':
                    tokens.add(Token.branchEnd());
                    break;
                case ',':
                    tokens.add(Token.branchNext());
                    break;
                default:
                    break;
            }
            i++;
        }
        return tokens;
    }

    /**
     * 同 {@link #tokenize(String)}，直接返回 token 文本，便于做文本级编辑。
     */
    public List<String> tokenizeToStrings(String text) {
        List<String> out = new ArrayList<>();
        for (Token t : tokenize(text)) {
            out.add(t.getText());
        }
        return out;
    }
}
