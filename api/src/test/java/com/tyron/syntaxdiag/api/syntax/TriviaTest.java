package com.tyron.syntaxdiag.api.syntax;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TriviaTest {

    @Test
    void mergingDropsOverlap() {
        assertEquals(" ", Trivia.space().merging(Trivia.space()).getText());
        assertEquals(" // c\n", Trivia.of(" ").merging(Trivia.of(" // c\n")).getText());
        assertEquals("\t ", Trivia.of("\t").merging(Trivia.of(" ")).getText());
        assertSame(Trivia.EMPTY, Trivia.EMPTY.merging(Trivia.EMPTY));
    }

    @Test
    void classification() {
        assertTrue(Trivia.of(" \t ").isSpacesOrTabs());
        assertFalse(Trivia.of(" \n").isSpacesOrTabs());
        assertTrue(Trivia.of(" \n").containsNewline());
        assertTrue(Trivia.of("\\\n").containsBackslash());
        assertEquals(2, Trivia.of("\u00A0").getByteLength());
    }
}
