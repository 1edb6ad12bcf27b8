package com.raditha.merge.similarity;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LevenshteinSimilarityTest {

    private final LevenshteinSimilarity similarity = new LevenshteinSimilarity();

    @Test
    void testDistance() {
        assertEquals(3, similarity.distance("kitten", "sitting"));
        assertEquals(0, similarity.distance("same", "same"));
        assertEquals(4, similarity.distance("", "abcd"));
    }

    @Test
    void testEmptyStrings() {
        assertEquals(1.0, similarity.calculate("", ""));
        assertEquals(0.0, similarity.calculate("", "abc"));
    }

    @Test
    void testSimilarity() {
        assertEquals(0.75, similarity.calculate("foo", "fooo"), 1e-9);
    }

    @Property
    void similarityIsBoundedAndSymmetric(@ForAll String a, @ForAll String b) {
        double forward = similarity.calculate(a, b);

        assertTrue(forward >= 0.0 && forward <= 1.0);
        assertEquals(forward, similarity.calculate(b, a), 1e-9);
    }
}
