package com.example.ladder.rung;

import com.example.ladder.model.RungSequence;
import com.example.ladder.parser.MalformedBranchEndException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RungTest {

    private static final String SIMPLE_BRANCH = "XIC(A)[XIC(B),XIC(C)]OTE(D)";

    @Test
    void parsesAndCachesSequence() {
        Rung rung = new Rung(3, SIMPLE_BRANCH);

        RungSequence seq = rung.getRungSequence();
        assertEquals(7, seq.size());
        assertSame(seq, rung.getRungSequence());
        assertTrue(rung.hasBranches());
        assertEquals(5, rung.getBranches().get("branch_0").getEndPosition());

        rung.setText("XIC(A)OTE(B)");
        assertNotSame(seq, rung.getRungSequence());
        assertFalse(rung.hasBranches());
    }

    @Test
    void malformedTextFailsToParse() {
        Rung rung = new Rung("XIC(A)]OTE(B)");

        assertThrows(MalformedBranchEndException.class, rung::getRungSequence);
        assertFalse(rung.validateBranchStructure());
    }

    @Test
    void listsInstructions() {
        Rung rung = new Rung(" XIC(A) [ XIC(B) , XIC(C) ] OTE(D) ;");

        assertEquals(List.of("XIC(A)", "XIC(B)", "XIC(C)", "OTE(D)"), rung.getInstructions());
    }

    @Test
    void insertBranchWrapsTokenRange() {
        Rung rung = new Rung("XIC(A)XIC(B)OTE(C)");

        rung.insertBranch(1, 2);

        assertEquals("XIC(A)[XIC(B),]OTE(C)", rung.getText());
        assertTrue(rung.getBranches().containsKey("branch_0"));
    }

    @Test
    void insertBranchAtEnd() {
        Rung rung = new Rung("XIC(A)XIC(B)OTE(C)");
        rung.insertBranch(0, 3);
        assertEquals("[XIC(A)XIC(B)OTE(C),]", rung.getText());

        Rung empty = new Rung("");
        empty.insertBranch(0, 0);
        assertEquals("[,]", empty.getText());
        assertEquals(3, empty.getRungSequence().size());
    }

    @Test
    void insertBranchValidatesPositions() {
        Rung rung = new Rung("XIC(A)XIC(B)OTE(C)");

        assertThrows(IllegalArgumentException.class, () -> rung.insertBranch(2, 1));
        assertThrows(IllegalArgumentException.class, () -> rung.insertBranch(-1, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> rung.insertBranch(0, 5));
        assertEquals("XIC(A)XIC(B)OTE(C)", rung.getText());
    }

    @Test
    void insertBranchLevelAddsEmptyPath() {
        Rung rung = new Rung(SIMPLE_BRANCH);
        rung.insertBranchLevel(1);
        assertEquals("XIC(A)[XIC(B),,XIC(C)]OTE(D)", rung.getText());

        Rung other = new Rung(SIMPLE_BRANCH);
        other.insertBranchLevel(3);
        assertEquals("XIC(A)[XIC(B),XIC(C),]OTE(D)", other.getText());
        assertEquals("branch_0:2", other.getRungSequence().get(5).getBranchId());
    }

    @Test
    void insertBranchLevelSkipsNestedGroups() {
        Rung rung = new Rung("[XIC(A)[XIC(B),XIC(C)],XIC(D)]");

        rung.insertBranchLevel(0);

        assertEquals("[XIC(A)[XIC(B),XIC(C)],,XIC(D)]", rung.getText());
    }

    @Test
    void insertBranchLevelRequiresBranchMarker() {
        Rung rung = new Rung(SIMPLE_BRANCH);

        assertThrows(IllegalArgumentException.class, () -> rung.insertBranchLevel(0));
        assertThrows(IndexOutOfBoundsException.class, () -> rung.insertBranchLevel(7));
    }

    @Test
    void removeWholeBranch() {
        Rung rung = new Rung(SIMPLE_BRANCH);

        rung.removeBranch("branch_0");

        assertEquals("XIC(A)OTE(D)", rung.getText());
        assertFalse(rung.hasBranches());
    }

    @Test
    void removeSiblingPath() {
        Rung rung = new Rung(SIMPLE_BRANCH);

        rung.removeBranch("branch_0:1");

        assertEquals("XIC(A)[XIC(B)]OTE(D)", rung.getText());
    }

    @Test
    void removeBranchRejectsUnknownOrFirstPath() {
        Rung rung = new Rung(SIMPLE_BRANCH);

        assertThrows(IllegalArgumentException.class, () -> rung.removeBranch("branch_9"));
        assertThrows(IllegalArgumentException.class, () -> rung.removeBranch("branch_0:0"));
        assertEquals(SIMPLE_BRANCH, rung.getText());
    }

    @Test
    void findsMatchingBranchEnd() {
        Rung rung = new Rung("XIC(A)[XIC(B),[XIC(C),XIC(D)]]");

        assertEquals(9, rung.findMatchingBranchEnd(1));
        assertEquals(8, rung.findMatchingBranchEnd(4));
        assertThrows(IllegalArgumentException.class, () -> rung.findMatchingBranchEnd(0));
        assertEquals(-1, new Rung("[XIC(A)").findMatchingBranchEnd(0));
        assertEquals(-1, new Rung("").findMatchingBranchEnd(0));
    }

    @Test
    void nestingLevels() {
        // 0 XIC(A) 1 [ 2 XIC(B) 3 , 4 [ 5 XIC(C) 6 , 7 XIC(D) 8 ] 9 ]
        Rung rung = new Rung("XIC(A)[XIC(B),[XIC(C),XIC(D)]]");

        assertEquals(0, rung.getBranchNestingLevel(0));
        assertEquals(1, rung.getBranchNestingLevel(2));
        assertEquals(2, rung.getBranchNestingLevel(5));
        assertEquals(0, rung.getBranchNestingLevel(9));
        assertEquals(2, rung.getMaxBranchDepth());
        assertEquals(1, rung.getBranchInternalNestingLevel(1));
        assertEquals(0, new Rung("XIC(A)OTE(B)").getMaxBranchDepth());
    }

    @Test
    void sequentialBranchesDoNotAddDepth() {
        Rung rung = new Rung("[XIC(A),XIC(B)][XIC(C),XIC(D)]OTE(E)");

        assertEquals(1, rung.getMaxBranchDepth());
    }

    @Test
    void validatesBranchStructure() {
        assertTrue(new Rung("[XIC(A),XIC(B)]").validateBranchStructure());
        assertTrue(new Rung("").validateBranchStructure());
        assertFalse(new Rung("[XIC(A)").validateBranchStructure());
        assertFalse(new Rung("]XIC(A)[").validateBranchStructure());
    }

    @Test
    void movesInstruction() {
        Rung rung = new Rung("XIC(A)XIC(B)OTE(C)");

        rung.moveInstruction(0, 2);
        assertEquals("XIC(B)OTE(C)XIC(A)", rung.getText());

        rung.moveInstruction(1, 1);
        assertEquals("XIC(B)OTE(C)XIC(A)", rung.getText());

        assertThrows(IndexOutOfBoundsException.class, () -> rung.moveInstruction(0, 3));
        assertThrows(IndexOutOfBoundsException.class, () -> rung.moveInstruction(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> new Rung("").moveInstruction(0, 0));
    }

    @Test
    void deeplyNestedTextParses() {
        int depth = 5_000;
        String text = "[".repeat(depth) + "XIC(A)" + "]".repeat(depth);
        Rung rung = new Rung(text);

        assertEquals(2 * depth + 1, rung.getRungSequence().size());
        assertEquals(depth, rung.getMaxBranchDepth());
        assertTrue(rung.validateBranchStructure());
    }
}
