package com.example.ladder.model;

public enum RungElementType {
    INSTRUCTION,
    BRANCH_START,
    BRANCH_END,
    BRANCH_NEXT
}
