package me.golemcore.relay.domain.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageChunkerTest {

    @Test
    void shouldReturnShortTextUnchanged() {
        assertEquals(List.of("hello"), MessageChunker.split("hello", 10));
    }

    @Test
    void shouldPreferNewlineBoundary() {
        List<String> chunks = MessageChunker.split("first line\nsecond line", 15);

        assertEquals(List.of("first line", "second line"), chunks);
    }

    @Test
    void shouldFallBackToSpaceBoundary() {
        List<String> chunks = MessageChunker.split("alpha beta gamma", 12);

        assertEquals(List.of("alpha beta", "gamma"), chunks);
    }

    @Test
    void shouldKeepSurrogatePairTogetherOnHardSplit() {
        String text = "abc\uD83D\uDE00def";

        List<String> chunks = MessageChunker.split(text, 4);

        assertEquals(List.of("abc", "\uD83D\uDE00de", "f"), chunks);
    }

    @Test
    void shouldHardSplitWithoutBoundaries() {
        List<String> chunks = MessageChunker.split("abcdefghij", 4);

        assertEquals(List.of("abcd", "efgh", "ij"), chunks);
    }

    @Test
    void shouldNeverExceedLimit() {
        String text = "lorem ipsum dolor sit amet\n".repeat(300);

        List<String> chunks = MessageChunker.split(text, 100);

        assertTrue(chunks.stream().allMatch(chunk -> chunk.length() <= 100));
    }

    @Test
    void shouldRejectNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> MessageChunker.split("x", 0));
    }
}
