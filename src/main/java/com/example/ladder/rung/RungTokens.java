package com.example.ladder.rung;

import java.util.ArrayList;
import java.util.List;

/**
 * rung token 列表（字符串形式）的纯函数操作，不修改入参。
 */
public final class RungTokens {

    public static final String BRANCH_START = "[";
    public static final String BRANCH_END = "]";
    public static final String BRANCH_NEXT = ",";

    private RungTokens() {
    }

    public static boolean isStructural(String token) {
        return BRANCH_START.equals(token) || BRANCH_END.equals(token) || BRANCH_NEXT.equals(token);
    }

    public static String join(List<String> tokens) {
        return String.join("", tokens);
    }

    public static List<String> removeToken(List<String> tokens, int index) {
        if (index < 0 || index >= tokens.size()) {
            throw new IndexOutOfBoundsException("Index must be within the bounds of the token list: " + index);
        }
        List<String> out = new ArrayList<>(tokens);
        out.remove(index);
        return out;
    }

    /**
     * 删除闭区间 [startIndex, endIndex] 内的 token，超出末尾的部分忽略。
     */
    public static List<String> removeTokens(List<String> tokens, int startIndex, int endIndex) {
        if (startIndex < 0 || endIndex < 0) {
            throw new IndexOutOfBoundsException("Start and end positions must be non-negative");
        }
        if (endIndex < startIndex) {
            throw new IllegalArgumentException("End position must be greater than or equal to start position");
        }
        List<String> out = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            if (i < startIndex || i > endIndex) {
                out.add(tokens.get(i));
            }
        }
        return out;
    }

    /**
     * 在 token 序列中插入一个分支：
     * startPos 之前写 '['，endPos 之前写 ',' + branchInstructions + ']'；
     * endPos == size 时分支收尾写在末尾。
     */
    public static List<String> insertBranchTokens(List<String> originalTokens,
                                                  int startPos,
                                                  int endPos,
                                                  List<String> branchInstructions) {
        if (endPos < startPos) {
            throw new IllegalArgumentException("End position must be greater than or equal to start position");
        }

        List<String> out = new ArrayList<>(originalTokens.size() + branchInstructions.size() + 3);
        int size = originalTokens.size();
        for (int i = 0; i < size; i++) {
            if (i == startPos) {
                out.add(BRANCH_START);
            }
            if (i == endPos) {
                writeBranchEnd(out, branchInstructions);
            }
            String token = originalTokens.get(i);
            if (token != null && !token.isEmpty()) {
                out.add(token);
            }
        }
        if (startPos == size) {
            out.add(BRANCH_START);
        }
        if (endPos == size) {
            writeBranchEnd(out, branchInstructions);
        }
        return out;
    }

    private static void writeBranchEnd(List<String> out, List<String> branchInstructions) {
        out.add(BRANCH_NEXT);
        out.addAll(branchInstructions);
        out.add(BRANCH_END);
    }
}
