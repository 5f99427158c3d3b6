package com.ragingest.ingest;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextChunkerTest {

    @Test
    void shouldReturnNothingForBlankText() {
        TextChunker chunker = new TextChunker(100, 10);

        assertEquals(List.of(), chunker.chunk(""));
        assertEquals(List.of(), chunker.chunk(" \n\t "));
        assertEquals(List.of(), chunker.chunk(null));
    }

    @Test
    void shouldReturnTrimmedTextWhenItFits() {
        assertEquals(List.of("short text"), new TextChunker(100, 10).chunk("  short text \n"));
    }

    @Test
    void shouldPackParagraphsGreedily() {
        String text = "aaaa\n\nbbbb\n\ncccc";

        List<String> chunks = new TextChunker(10, 0).chunk(text);

        assertEquals(List.of("aaaa\n\nbbbb", "cccc"), chunks);
    }

    @Test
    void shouldSeedNextChunkWithTailOfPreviousChunk() {
        String text = "first paragraph here\n\nsecond one";

        List<String> chunks = new TextChunker(25, 5).chunk(text);

        assertEquals(List.of("first paragraph here", "here\n\nsecond one"), chunks);
    }

    @Test
    void shouldSkipSeedWhenSeededChunkWouldOverflow() {
        String text = "0123456789\n\nabcdefghij";

        List<String> chunks = new TextChunker(10, 4).chunk(text);

        assertEquals(List.of("0123456789", "abcdefghij"), chunks);
    }

    @Test
    void shouldSplitLongParagraphAtSentenceBoundaries() {
        String text = "One sentence here. Two sentence here. Three sentence here. Four sentence here.";

        List<String> chunks = new TextChunker(40, 0).chunk(text);

        assertEquals(List.of("One sentence here. Two sentence here.", "Three sentence here. Four sentence here."), chunks);
    }

    @Test
    void shouldFallBackToWordBoundaryThenHardCut() {
        TextChunker chunker = new TextChunker(10, 0);

        assertEquals(List.of("alpha", "beta gamma"), chunker.splitLongText("alpha beta gamma"));
        assertEquals(List.of("abcdefghij", "klmno"), chunker.splitLongText("abcdefghijklmno"));
    }

    @Test
    void shouldKeepEveryChunkWithinSizeAndCoverAllWords() {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 120; i++) {
            text.append("Sentence number ").append(i).append(" talks about vectors. ");
            if (i % 17 == 16) {
                text.append("\n\n");
            }
        }

        List<String> chunks = new TextChunker(128, 24).chunk(text.toString());

        assertTrue(chunks.size() > 10);
        for (String chunk : chunks) {
            assertTrue(chunk.length() <= 128, "chunk too long: " + chunk.length());
            assertFalse(chunk.isBlank());
        }
        String joined = String.join(" ", chunks);
        for (int i = 0; i < 120; i++) {
            assertTrue(joined.contains("number " + i + " "), "missing sentence " + i);
        }
    }

    @Test
    void shouldMakeProgressWhenOverlapIsNotSmallerThanChunkSize() {
        List<String> chunks = new TextChunker(5, 10).chunk("abcdefghijklmnopqrst");

        assertFalse(chunks.isEmpty());
        assertTrue(chunks.stream().allMatch(chunk -> chunk.length() <= 5));
        assertTrue(chunks.get(chunks.size() - 1).endsWith("t"));
    }

    @Test
    void shouldBeDeterministic() {
        String text = "Alpha beta gamma. ".repeat(40);
        TextChunker chunker = new TextChunker(64, 16);

        assertEquals(chunker.chunk(text), chunker.chunk(text));
    }

    @Test
    void shouldRejectInvalidSizes() {
        assertThrows(IllegalArgumentException.class, () -> new TextChunker(0, 0));
        assertThrows(IllegalArgumentException.class, () -> new TextChunker(10, -1));
        assertThrows(IllegalArgumentException.class, () -> new TextChunker(10, 0, ""));
    }
}
