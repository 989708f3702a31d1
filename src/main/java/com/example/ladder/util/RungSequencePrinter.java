package com.example.ladder.util;

import com.example.ladder.model.RungBranch;
import com.example.ladder.model.RungElement;
import com.example.ladder.model.RungSequence;

public class RungSequencePrinter {

    private static final String IND = "  ";

    /**
     * 每个元素一行，分支内部按 '[' 深度缩进，例如：
     * <pre>
     * RungSequence {
     *   [0] XIC(A)
     *   [1] [ branch_0
     *     [2] XIC(B)  (branch_0:0, level=0)
     *   ...
     * </pre>
     */
    public static String prettyPrint(RungSequence seq) {
        StringBuilder sb = new StringBuilder();
        if (seq == null) {
            return "RungSequence: null\n";
        }

        sb.append("RungSequence {\n");
        int depth = 1;
        for (RungElement e : seq.getElements()) {
            switch (e.getElementType()) {
                case BRANCH_START:
                    line(sb, depth, e, "[ " + e.getBranchId());
                    depth++;
                    break;
                case BRANCH_NEXT:
                    line(sb, depth - 1, e, ", " + e.getBranchId());
                    break;
                case BRANCH_END:
                    depth--;
                    line(sb, depth, e, "] " + e.getBranchId());
                    break;
                default:
                    line(sb, depth, e, e.getInstruction() + scope(e));
                    break;
            }
        }
        sb.append("}\n");

        if (!seq.getBranches().isEmpty()) {
            sb.append("Branches {\n");
            for (RungBranch b : seq.getBranches().branches()) {
                sb.append(IND).append(b.getBranchId())
                        .append(" ").append(b.getStartPosition()).append("..").append(b.getEndPosition());
                if (!b.isTopLevel()) {
                    sb.append(" root=").append(b.getRootBranchId());
                }
                sb.append("\n");
            }
            sb.append("}\n");
        }
        return sb.toString();
    }

    private static void line(StringBuilder sb, int depth, RungElement e, String body) {
        sb.append(indent(depth)).append("[").append(e.getPosition()).append("] ").append(body).append("\n");
    }

    private static String scope(RungElement e) {
        if (e.isTopLevel()) return "";
        return "  (" + e.getBranchId() + ", level=" + e.getBranchLevel() + ")";
    }

    private static String indent(int n) {
        return IND.repeat(Math.max(n, 0));
    }
}
