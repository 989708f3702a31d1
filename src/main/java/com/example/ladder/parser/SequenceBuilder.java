package com.example.ladder.parser;

import com.example.ladder.model.BranchRegistry;
import com.example.ladder.model.RungBranch;
import com.example.ladder.model.RungElement;
import com.example.ladder.model.RungElementType;
import com.example.ladder.model.RungSequence;
import com.example.ladder.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单遍栈式状态机：token 流 -> 按位置排列的 RungElement 序列 + 分支索引。
 * <p>
 * 作用域字段：
 *  - branchId     : 当前所在的最内层作用域（并联路径 id），顶层为 ""
 *  - rootBranchId : 最近一个包围的 '[' 的分支 id，顶层为 ""
 *  - branchLevel  : 当前作用域的层号；顶层 '[' 归零，嵌套 '[' 为外层层号 + 1，
 *                   每个 ',' 加 1
 * <p>
 * id 规则：每个 '[' 分配 {prefix}{n}（n 为本次解析内单调递增的计数），
 * 分支内的并联路径为 {分支id}:{branchLevel}，'[' 自带第一条路径。
 * <p>
 * 一次解析失败后实例不可再用，调用方应丢弃并重新创建。
 */
public class SequenceBuilder {

    private static final Logger log = LoggerFactory.getLogger(SequenceBuilder.class);

    public static final String DEFAULT_BRANCH_ID_PREFIX = "branch_";

    private final String branchIdPrefix;

    private String branchId = "";
    private String rootBranchId = "";
    private int branchLevel = 0;

    private int position = 0;
    private int branchIdCounter = 0;

    private final Deque<BranchFrame> branchStack = new ArrayDeque<>();
    private final Map<String, BranchNode> branches = new LinkedHashMap<>();
    private final List<RungElement> sequence = new ArrayList<>();

    private BranchRegistry registry = BranchRegistry.empty();
    private boolean failed = false;

    public SequenceBuilder() {
        this(DEFAULT_BRANCH_ID_PREFIX);
    }

    public SequenceBuilder(String branchIdPrefix) {
        if (branchIdPrefix == null || branchIdPrefix.isEmpty()) {
            throw new IllegalArgumentException("branchIdPrefix must not be empty");
        }
        this.branchIdPrefix = branchIdPrefix;
    }

    public RungSequence buildSequence(List<Token> tokens) {
        if (failed) {
            throw new IllegalStateException("SequenceBuilder failed on a previous parse and must be discarded");
        }
        reset();

        try {
            for (Token token : tokens) {
                sequence.add(processToken(token));
                position++;
            }
            if (!branchStack.isEmpty()) {
                BranchNode open = branches.get(branchStack.peek().branchId);
                throw new UnclosedBranchException(open.start, open.id);
            }
        } catch (RungParseException e) {
            failed = true;
            throw e;
        }

        registry = freeze();
        RungSequence result = new RungSequence(sequence, registry);
        reset();
        return result;
    }

    public RungSequence buildSequenceFromStrings(List<String> rawTokens) {
        List<Token> tokens = new ArrayList<>(rawTokens.size());
        for (String raw : rawTokens) {
            tokens.add(Token.of(raw));
        }
        return buildSequence(tokens);
    }

    /** 最近一次成功解析得到的分支索引 */
    public BranchRegistry getBranches() {
        return registry;
    }

    public boolean isFailed() {
        return failed;
    }

    private void reset() {
        branchId = "";
        rootBranchId = "";
        branchLevel = 0;
        position = 0;
        branchIdCounter = 0;
        branchStack.clear();
        branches.clear();
        sequence.clear();
    }

    private RungElement processToken(Token token) {
        return switch (token.getType()) {
            case INSTRUCTION -> processInstruction(token.getText());
            case BRANCH_START -> processBranchStart();
            case BRANCH_NEXT -> processBranchNext();
            case BRANCH_END -> processBranchEnd();
        };
    }

    private RungElement processInstruction(String text) {
        if (text == null || text.isBlank()) {
            throw new EmptyInstructionTokenException(position);
        }
        return element(RungElementType.INSTRUCTION, text, branchId, rootBranchId, branchLevel);
    }

    private RungElement processBranchStart() {
        String parentRootId = rootBranchId;
        int parentLevel = branchLevel;
        boolean nested = !branchStack.isEmpty();

        BranchNode branch = new BranchNode(nextBranchId(), parentRootId, position);
        branches.put(branch.id, branch);
        if (nested) {
            // 子分支挂在当前所在的并联路径下
            branches.get(branchId).nested.add(branch);
        }

        branchStack.push(new BranchFrame(branch.id, parentRootId, parentLevel));
        rootBranchId = branch.id;
        branchLevel = nested ? parentLevel + 1 : 0;
        branchId = pathId(branch.id, branchLevel);
        openPath(branch, branchId);

        log.debug("Open branch {} at {} (root='{}', level={})", branch.id, position, parentRootId, branchLevel);
        return element(RungElementType.BRANCH_START, null, branch.id, parentRootId, parentLevel);
    }

    private RungElement processBranchNext() {
        BranchFrame frame = branchStack.peek();
        if (frame == null) {
            throw new MalformedBranchContinuationException(position);
        }

        BranchNode branch = branches.get(frame.branchId);
        closeLastNestedBranch(branch, position - 1, position);

        branchLevel++;
        branchId = pathId(branch.id, branchLevel);
        openPath(branch, branchId);

        return element(RungElementType.BRANCH_NEXT, null, branchId, rootBranchId, branchLevel);
    }

    private RungElement processBranchEnd() {
        if (branchStack.isEmpty()) {
            throw new MalformedBranchEndException(position);
        }
        BranchFrame frame = branchStack.pop();

        BranchNode branch = branches.get(frame.branchId);
        branch.end = position;
        closeLastNestedBranch(branch, position - 1, position);

        rootBranchId = frame.rootBranchId;
        branchLevel = frame.branchLevel;
        branchId = rootBranchId.isEmpty() ? "" : pathId(rootBranchId, branchLevel);

        log.debug("Close branch {} at {} ({} paths)", branch.id, position, branch.nested.size());
        return element(RungElementType.BRANCH_END, null, branch.id, rootBranchId, branchLevel);
    }

    /**
     * 把 branch 最后一条并联路径的结束位置定为 end。
     */
    static void closeLastNestedBranch(BranchNode branch, int end, int position) {
        BranchNode last = branch.lastNested();
        if (last == null) {
            throw new MissingNestedBranchRecordException(position, branch.id);
        }
        last.end = end;
    }

    private void openPath(BranchNode branch, String id) {
        BranchNode path = new BranchNode(id, branch.id, position);
        branch.nested.add(path);
        branches.put(id, path);
    }

    private String nextBranchId() {
        return branchIdPrefix + branchIdCounter++;
    }

    private static String pathId(String branchId, int level) {
        return branchId + ":" + level;
    }

    private RungElement element(RungElementType type, String instruction,
                                String branchId, String rootBranchId, int level) {
        return RungElement.builder()
                .elementType(type)
                .instruction(instruction)
                .branchId(branchId)
                .rootBranchId(rootBranchId)
                .branchLevel(level)
                .position(position)
                .build();
    }

    /**
     * 子节点总是在父节点之后放进 branches，倒序冻结时子节点已经就绪，不需要递归。
     */
    private BranchRegistry freeze() {
        List<BranchNode> nodes = new ArrayList<>(branches.values());
        Map<String, RungBranch> frozen = new HashMap<>(nodes.size() * 2);
        for (int i = nodes.size() - 1; i >= 0; i--) {
            BranchNode node = nodes.get(i);
            List<RungBranch> children = new ArrayList<>(node.nested.size());
            for (BranchNode child : node.nested) {
                children.add(frozen.get(child.id));
            }
            frozen.put(node.id, new RungBranch(node.id, node.rootId, node.start, node.end, children));
        }

        List<RungBranch> ordered = new ArrayList<>(nodes.size());
        for (BranchNode node : nodes) {
            ordered.add(frozen.get(node.id));
        }
        return BranchRegistry.of(ordered);
    }

    /** 打开分支时压栈：分支 id + 打开前的 rootBranchId / branchLevel */
    private static final class BranchFrame {
        final String branchId;
        final String rootBranchId;
        final int branchLevel;

        BranchFrame(String branchId, String rootBranchId, int branchLevel) {
            this.branchId = branchId;
            this.rootBranchId = rootBranchId;
            this.branchLevel = branchLevel;
        }
    }
}
