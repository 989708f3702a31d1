package com.example.ladder.parser;

public class EmptyInstructionTokenException extends RungParseException {

    public EmptyInstructionTokenException(int position) {
        super("Empty instruction token at position " + position, position, "");
    }
}
