package com.captainsprep.engine.service.ingestion;

import com.captainsprep.engine.model.Chunk;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SentenceBoundaryTextChunkerTest {

    private final SentenceBoundaryTextChunker chunker = new SentenceBoundaryTextChunker(1000, 200);

    @Test
    void fortySentencesAreCutAtSentenceEndsWithBoundedOverlap() {
        String text = IntStream.rangeClosed(1, 40)
                .mapToObj(i -> String.format("Sentence %02d explains how the pump operator sets pressure. ", i))
                .collect(Collectors.joining());

        List<Chunk> chunks = chunker.chunk(text, 200, 50);

        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(chunks.get(0).start()).isZero();
        assertThat(chunks.get(chunks.size() - 1).end()).isEqualTo(text.length());
        for (int i = 0; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i);
            assertThat(chunk.index()).isEqualTo(i);
            assertThat(chunk.text()).isNotBlank();
            assertThat(chunk.end() - chunk.start()).isLessThanOrEqualTo(200);
            if (i < chunks.size() - 1) {
                Chunk next = chunks.get(i + 1);
                assertThat(chunk.text()).endsWith(".");
                assertThat(next.start()).isGreaterThan(chunk.start());
                assertThat(next.start()).isLessThanOrEqualTo(chunk.end());
                assertThat(chunk.end() - next.start()).isLessThanOrEqualTo(50);
            }
        }
    }

    @Test
    void textWithoutBoundariesIsHardCut() {
        String text = "a".repeat(450);

        List<Chunk> chunks = chunker.chunk(text, 200, 50);

        assertThat(chunks)
                .extracting(Chunk::start, Chunk::end)
                .containsExactly(
                        org.assertj.core.groups.Tuple.tuple(0, 200),
                        org.assertj.core.groups.Tuple.tuple(150, 350),
                        org.assertj.core.groups.Tuple.tuple(300, 450));
    }

    @Test
    void boundaryInsideTheOverlapIsIgnored() {
        String text = "Hi. " + "b".repeat(300);

        List<Chunk> chunks = chunker.chunk(text, 100, 20);

        assertThat(chunks.get(0).end()).isEqualTo(100);
        assertThat(chunks.get(chunks.size() - 1).end()).isEqualTo(text.length());
    }

    @Test
    void shortTextProducesSingleChunk() {
        List<Chunk> chunks = chunker.chunk("  Pump pressure matters.  ");

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).text()).isEqualTo("Pump pressure matters.");
        assertThat(chunks.get(0).start()).isZero();
        assertThat(chunks.get(0).end()).isEqualTo(26);
    }

    @Test
    void emptyOrBlankTextProducesNoChunks() {
        assertThat(chunker.chunk("")).isEmpty();
        assertThat(chunker.chunk(null)).isEmpty();
        assertThat(chunker.chunk("      ")).isEmpty();
    }

    @Test
    void rejectsOverlapNotSmallerThanChunkSize() {
        assertThatThrownBy(() -> chunker.chunk("text", 100, 100))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> chunker.chunk("text", 100, -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SentenceBoundaryTextChunker(50, 80))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
