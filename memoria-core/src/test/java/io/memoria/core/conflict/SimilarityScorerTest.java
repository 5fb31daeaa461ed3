package io.memoria.core.conflict;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class SimilarityScorerTest {

    @Test
    void shouldScoreIdenticalTextsAsOne() {
        assertThat(SimilarityScorer.jaccard("Dentist appt Tuesday 3pm", "Dentist appt Tuesday 3pm")).isEqualTo(1.0);
    }

    @Test
    void shouldIgnoreCasePunctuationAndShortWords() {
        assertThat(SimilarityScorer.jaccard("I live in Berlin!", "i LIVE in berlin")).isEqualTo(1.0);
        assertThat(SimilarityScorer.words("I am at the gym, ok?")).containsExactly("the", "gym");
    }

    @Test
    void shouldReturnZeroWhenEitherSideHasNoQualifyingWord() {
        assertThat(SimilarityScorer.jaccard("", "something here")).isZero();
        assertThat(SimilarityScorer.jaccard("a b c", "something here")).isZero();
        assertThat(SimilarityScorer.jaccard(null, "something here")).isZero();
    }

    @Test
    void shouldComputeOverlapOverUnion() {
        double score = SimilarityScorer.jaccard("works at Google office", "works at Amazon office");

        assertThat(score).isCloseTo(2.0 / 4.0, within(1e-9));
    }

    @Test
    void shouldBeSymmetricAndBounded() {
        String left = "my sister Anna lives in Lisbon";
        String right = "Anna moved from Lisbon to Porto";

        double forward = SimilarityScorer.jaccard(left, right);

        assertThat(forward).isEqualTo(SimilarityScorer.jaccard(right, left));
        assertThat(forward).isBetween(0.0, 1.0);
    }
}
