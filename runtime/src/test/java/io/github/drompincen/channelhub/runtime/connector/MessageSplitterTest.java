package io.github.drompincen.channelhub.runtime.connector;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MessageSplitterTest {

    @Test
    void shortTextIsASingleChunk() {
        assertThat(MessageSplitter.split("hello", 100)).containsExactly("hello");
        assertThat(MessageSplitter.split("", 100)).isEmpty();
    }

    @Test
    void prefersParagraphBreaks() {
        String text = "a".repeat(60) + "\n\n" + "b".repeat(60);

        assertThat(MessageSplitter.split(text, 100)).containsExactly("a".repeat(60), "b".repeat(60));
    }

    @Test
    void fallsBackToSentenceEnds() {
        String text = "A".repeat(50) + ". " + "B".repeat(80);

        assertThat(MessageSplitter.split(text, 100)).containsExactly("A".repeat(50) + ".", "B".repeat(80));
    }

    @Test
    void ignoresBreaksTooCloseToTheStart() {
        String text = "ab cd" + "x".repeat(200);

        List<String> chunks = MessageSplitter.split(text, 100);

        assertThat(chunks.get(0)).hasSize(100);
    }

    @Test
    void hardCutsUnbrokenText() {
        List<String> chunks = MessageSplitter.split("x".repeat(250), 100);

        assertThat(chunks).hasSize(3);
        assertThat(chunks.get(2)).hasSize(50);
        assertThat(chunks).allSatisfy(c -> assertThat(c.length()).isLessThanOrEqualTo(100));
    }

    @Test
    void labelsEveryChunkAfterTheFirst() {
        assertThat(MessageSplitter.label(List.of("one", "two", "three")))
                .containsExactly("one", "[2/3]\ntwo", "[3/3]\nthree");
        assertThat(MessageSplitter.label(List.of("only"))).containsExactly("only");
    }
}
