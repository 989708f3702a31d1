package com.example.ladder.rung;

import com.example.ladder.model.BranchRegistry;
import com.example.ladder.model.RungBranch;
import com.example.ladder.model.RungSequence;
import com.example.ladder.parser.RungTokenizer;
import com.example.ladder.parser.SequenceBuilder;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 一条梯形图 rung：文本 + 解析缓存 + 基于 token 的结构编辑。
 * <p>
 * 所有编辑都是：分词 -> 改 token 列表 -> 拼回文本 -> 清空缓存。
 * 拼回的文本不含空白，是规范形式。
 * <p>
 * 非线程安全，多线程修改需调用方自行串行化。
 */
public class Rung {

    @Getter
    @Setter
    private int number;

    @Getter
    @Setter
    private String comment = "";

    @Getter
    private String text = "";

    private final RungTokenizer tokenizer;
    private final String branchIdPrefix;

    private RungSequence sequence;

    public Rung(String text) {
        this(0, text);
    }

    public Rung(int number, String text) {
        this(number, text, new RungTokenizer(), SequenceBuilder.DEFAULT_BRANCH_ID_PREFIX);
    }

    public Rung(int number, String text, RungTokenizer tokenizer, String branchIdPrefix) {
        this.number = number;
        this.tokenizer = tokenizer;
        this.branchIdPrefix = branchIdPrefix;
        setText(text);
    }

    public void setText(String text) {
        this.text = text == null ? "" : text;
        invalidate();
    }

    public void invalidate() {
        sequence = null;
    }

    public List<String> tokenize() {
        return tokenizer.tokenizeToStrings(text);
    }

    /**
     * @throws com.example.ladder.parser.RungParseException 文本结构非法
     */
    public RungSequence getRungSequence() {
        if (sequence == null) {
            sequence = new SequenceBuilder(branchIdPrefix).buildSequence(tokenizer.tokenize(text));
        }
        return sequence;
    }

    public BranchRegistry getBranchRegistry() {
        return getRungSequence().getBranches();
    }

    public Map<String, RungBranch> getBranches() {
        return getBranchRegistry().asMap();
    }

    public boolean hasBranches() {
        return !getBranchRegistry().isEmpty();
    }

    public List<String> getInstructions() {
        List<String> out = new ArrayList<>();
        for (String token : tokenize()) {
            if (!RungTokens.isStructural(token)) out.add(token);
        }
        return out;
    }

    /**
     * @return startPosition 处 '[' 对应的 ']' 下标，找不到返回 -1
     */
    public int findMatchingBranchEnd(int startPosition) {
        if (text.isEmpty()) {
            return -1;
        }
        List<String> tokens = tokenize();
        if (startPosition < 0 || startPosition >= tokens.size()
                || !RungTokens.BRANCH_START.equals(tokens.get(startPosition))) {
            throw new IllegalArgumentException("Start position must be a valid branch start token position: " + startPosition);
        }

        int depth = 1;
        for (int i = startPosition + 1; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (RungTokens.BRANCH_START.equals(token)) {
                depth++;
            } else if (RungTokens.BRANCH_END.equals(token)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * 分支内部嵌套分组里 ',' 的最大个数（即嵌套分组的最大并联层数）。
     */
    public int getBranchInternalNestingLevel(int branchPosition) {
        int end = findMatchingBranchEnd(branchPosition);
        if (end < 0) {
            throw new IllegalArgumentException("No matching end found for branch starting at position " + branchPosition);
        }

        List<String> tokens = tokenize();
        int open = 0;
        int commas = 0;
        int level = 0;
        for (String token : tokens.subList(branchPosition + 1, end)) {
            if (RungTokens.BRANCH_START.equals(token)) {
                open++;
            } else if (RungTokens.BRANCH_NEXT.equals(token) && open > 0) {
                commas++;
                level = Math.max(level, commas);
            } else if (RungTokens.BRANCH_END.equals(token)) {
                open--;
                if (open < 0) {
                    throw new IllegalArgumentException("Mismatched brackets in rung text");
                }
            }
        }
        return level;
    }

    /**
     * @return position 处 token 所在的 '[' 层数，0 表示主线
     */
    public int getBranchNestingLevel(int position) {
        if (text.isEmpty()) {
            return 0;
        }
        List<String> tokens = tokenize();
        int level = 0;
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (RungTokens.BRANCH_START.equals(token)) {
                level++;
            } else if (RungTokens.BRANCH_END.equals(token)) {
                level--;
            }
            if (i == position) {
                return level;
            }
        }
        return 0;
    }

    /**
     * @return 分支最大嵌套深度，0 表示没有分支
     */
    public int getMaxBranchDepth() {
        int depth = 0;
        int max = 0;
        for (String token : tokenize()) {
            if (RungTokens.BRANCH_START.equals(token)) {
                depth++;
                max = Math.max(max, depth);
            } else if (RungTokens.BRANCH_END.equals(token)) {
                depth--;
            }
        }
        return max;
    }

    public boolean validateBranchStructure() {
        int depth = 0;
        for (String token : tokenize()) {
            if (RungTokens.BRANCH_START.equals(token)) {
                depth++;
            } else if (RungTokens.BRANCH_END.equals(token)) {
                depth--;
                if (depth < 0) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    /**
     * 把 token [startPos, endPos) 包进一个新分支，并带一条空的第二路径。
     */
    public void insertBranch(int startPos, int endPos) {
        List<String> tokens = tokenize();
        if (startPos < 0 || endPos < 0) {
            throw new IllegalArgumentException("Branch positions must be non-negative");
        }
        if (startPos > tokens.size() || endPos > tokens.size()) {
            throw new IndexOutOfBoundsException("Branch positions out of range: " + startPos + ".." + endPos);
        }
        if (startPos > endPos) {
            throw new IllegalArgumentException("Start position must be less than or equal to end position");
        }
        setText(RungTokens.join(RungTokens.insertBranchTokens(tokens, startPos, endPos, List.of())));
    }

    /**
     * 在 branchPosition（'[' 或 ','）所在分组里增加一条空路径：
     * 在该路径之后第一个同层的 ',' 或 ']' 前插入 ','。
     */
    public void insertBranchLevel(int branchPosition) {
        List<String> tokens = tokenize();
        if (branchPosition < 0 || branchPosition >= tokens.size()) {
            throw new IndexOutOfBoundsException("Start position out of range: " + branchPosition);
        }
        String marker = tokens.get(branchPosition);
        if (!RungTokens.BRANCH_START.equals(marker) && !RungTokens.BRANCH_NEXT.equals(marker)) {
            throw new IllegalArgumentException("Start position must be on a branch start or next-branch token");
        }

        int index = branchPosition + 1;
        int depth = 0;
        while (index < tokens.size()) {
            String token = tokens.get(index);
            if (RungTokens.BRANCH_START.equals(token)) {
                depth++;
            } else if (RungTokens.BRANCH_END.equals(token)) {
                if (depth <= 0) {
                    break;
                }
                depth--;
            } else if (RungTokens.BRANCH_NEXT.equals(token) && depth <= 0) {
                break;
            }
            index++;
        }
        if (index >= tokens.size()) {
            throw new IllegalArgumentException("No next branch marker found after position " + branchPosition);
        }

        List<String> out = new ArrayList<>(tokens);
        out.add(index, RungTokens.BRANCH_NEXT);
        setText(RungTokens.join(out));
    }

    /**
     * 删除一个分支（'[' .. ']' 全部 token）或分支中的一条非首路径（',' 及其内容）。
     */
    public void removeBranch(String branchId) {
        RungBranch branch = getBranchRegistry().get(branchId)
                .orElseThrow(() -> new IllegalArgumentException("Branch '" + branchId + "' not found in rung"));
        if (branch.getStartPosition() < 0 || branch.getEndPosition() < 0) {
            throw new IllegalArgumentException("Branch start or end position is invalid");
        }

        List<String> tokens = tokenize();
        String first = tokens.get(branch.getStartPosition());
        String last = tokens.get(branch.getEndPosition());
        boolean wholeBranch = RungTokens.BRANCH_START.equals(first) && RungTokens.BRANCH_END.equals(last);
        boolean siblingPath = RungTokens.BRANCH_NEXT.equals(first);
        if (!wholeBranch && !siblingPath) {
            throw new IllegalArgumentException("Branch '" + branchId + "' is the first path of its branch and cannot be removed alone");
        }

        setText(RungTokens.join(RungTokens.removeTokens(tokens, branch.getStartPosition(), branch.getEndPosition())));
    }

    public void moveInstruction(int oldPosition, int newPosition) {
        List<String> tokens = tokenize();
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("No instructions found in rung");
        }
        if (newPosition < 0 || newPosition >= tokens.size()) {
            throw new IndexOutOfBoundsException("New position " + newPosition + " out of range");
        }
        if (oldPosition < 0 || oldPosition >= tokens.size()) {
            throw new IndexOutOfBoundsException("Instruction index " + oldPosition + " out of range");
        }
        if (oldPosition == newPosition) {
            return;
        }

        List<String> out = new ArrayList<>(tokens);
        String moved = out.remove(oldPosition);
        out.add(newPosition, moved);
        setText(RungTokens.join(out));
    }

    @Override
    public String toString() {
        return "Rung{number=" + number + ", text='" + text + "'}";
    }
}
