package io.github.drompincen.imagechat.runtime.generation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConverseHeuristicsTest {

    private final ConverseHeuristics heuristics = new ConverseHeuristics();

    @Test
    void explicitImageRequestGenerates() {
        assertThat(heuristics.decide("Create a banner for our autumn collection", false))
                .isEqualTo(GenerationMode.GENERATE);
    }

    @Test
    void revisionCueRefinesOnlyWithPriorImage() {
        assertThat(heuristics.decide("make the background darker", true)).isEqualTo(GenerationMode.REFINE);
        assertThat(heuristics.decide("make the background darker", false)).isEqualTo(GenerationMode.CHAT);
    }

    @Test
    void questionsStayConversational() {
        assertThat(heuristics.decide("What colors work best for a luxury brand?", true))
                .isEqualTo(GenerationMode.CHAT);
        assertThat(heuristics.decide("How should I design a poster for a bakery?", false))
                .isEqualTo(GenerationMode.CHAT);
    }

    @Test
    void newImageRequestWinsOverRevisionWords() {
        assertThat(heuristics.decide("Draw a new poster instead", true)).isEqualTo(GenerationMode.GENERATE);
    }
}
