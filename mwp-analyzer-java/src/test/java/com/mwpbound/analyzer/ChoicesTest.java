package com.mwpbound.analyzer;

import com.mwpbound.analyzer.relation.Choices;
import com.mwpbound.analyzer.semiring.Delta;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ChoicesTest {

    private static final List<Integer> DOMAIN = List.of(0, 1, 2);

    private static List<Delta> path(int... valueIndexPairs) {
        Delta[] deltas = new Delta[valueIndexPairs.length / 2];
        for (int k = 0; k < deltas.length; k++) {
            deltas[k] = new Delta(valueIndexPairs[2 * k], valueIndexPairs[2 * k + 1]);
        }
        return List.of(deltas);
    }

    @Test
    void domainCanBeParameterized() {
        Set<List<Delta>> infinity = Set.of(
            path(0, 0, 0, 1),
            path(0, 0, 1, 1, 3, 2),
            path(1, 0, 1, 1, 3, 2),
            path(2, 0, 1, 1, 3, 2),
            path(3, 0, 1, 1, 3, 2));
        Choices result = Choices.generate(List.of(0, 1, 2, 3), 3, infinity);

        assertFalse(result.isInfinite());
        assertEquals(4, result.valid().size());
        assertTrue(result.valid().contains(List.of(List.of(1, 2, 3), List.of(0, 2, 3), List.of(0, 1, 2, 3))));
        assertTrue(result.valid().contains(List.of(List.of(1, 2, 3), List.of(0, 1, 2, 3), List.of(0, 1, 2))));
        assertTrue(result.valid().contains(List.of(List.of(0, 1, 2, 3), List.of(2, 3), List.of(0, 1, 2, 3))));
        assertTrue(result.valid().contains(List.of(List.of(0, 1, 2, 3), List.of(1, 2, 3), List.of(0, 1, 2))));
    }

    @Test
    void everyVariantInfiniteAtOneIndexIsInfinite() {
        Set<List<Delta>> infinity = Set.of(path(0, 3), path(1, 3), path(2, 3));
        Choices result = Choices.generate(DOMAIN, 4, infinity);
        assertTrue(result.isInfinite());
        assertThrows(IllegalStateException.class, result::first);
    }

    @Test
    void isValidRejectsChoicesOnInfinitePaths() {
        Choices choices = Choices.generate(DOMAIN, 2, Set.of(path(0, 1), path(1, 0, 2, 1)));

        assertFalse(choices.isValid(0, 0));
        assertFalse(choices.isValid(1, 0));
        assertFalse(choices.isValid(2, 0));
        assertFalse(choices.isValid(1, 2));

        assertTrue(choices.isValid(0, 1));
        assertTrue(choices.isValid(1, 1));
        assertTrue(choices.isValid(2, 1));
        assertTrue(choices.isValid(0, 2));
        assertTrue(choices.isValid(2, 2));
    }

    @Test
    void resultIsMinimal() {
        Set<List<Delta>> infinity = Set.of(
            path(0, 0),
            path(1, 0),
            path(2, 1, 1, 2),
            path(2, 0, 1, 1, 1, 2));
        Choices result = Choices.generate(DOMAIN, 3, infinity);

        assertTrue(result.valid().contains(List.of(List.of(2), List.of(0, 1, 2), List.of(0, 2))));
        assertFalse(result.valid().contains(List.of(List.of(2), List.of(0, 1), List.of(0, 2))));
        assertFalse(result.valid().contains(List.of(List.of(2), List.of(0, 2), List.of(0, 2))));
        assertTrue(result.valid().contains(List.of(List.of(2), List.of(0), List.of(0, 1, 2))));
    }

    @Test
    void noInfinityAllowsEveryChoice() {
        Choices result = Choices.generate(DOMAIN, 2, Set.of());
        assertEquals(List.of(List.of(List.of(0, 1, 2), List.of(0, 1, 2))), result.valid());
        assertArrayEquals(new int[]{0, 0}, result.first());
    }

    @Test
    void zeroChoicePointsGiveOneEmptyChoice() {
        Choices result = Choices.generate(DOMAIN, 0, Set.of());
        assertFalse(result.isInfinite());
        assertEquals(0, result.first().length);
    }

    @Test
    void firstTakesSmallestVariantOfFirstVector() {
        Choices result = Choices.generate(DOMAIN, 2, Set.of(path(0, 0), path(1, 0, 0, 1)));
        assertEquals(List.of(
            List.of(List.of(2), List.of(0, 1, 2)),
            List.of(List.of(1, 2), List.of(1, 2))), result.valid());
        assertArrayEquals(new int[]{2, 0}, result.first());
    }

    @Test
    void reduceIntersectsChoiceSets() {
        Choices a = Choices.generate(DOMAIN, 1, Set.of(path(0, 0)));
        Choices b = Choices.generate(DOMAIN, 1, Set.of(path(2, 0)));
        Choices reduced = Choices.reduce(a, b);
        assertEquals(List.of(List.of(List.of(1))), reduced.valid());

        Choices c = Choices.generate(DOMAIN, 1, Set.of(path(1, 0)));
        assertTrue(Choices.reduce(a, b, c).isInfinite());
    }

    @Test
    void pathOutsideChoicePointsIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> Choices.generate(DOMAIN, 1, Set.of(path(0, 3))));
    }

    @Test
    void unrestrictedVectorCannotBeModified() {
        Choices choices = Choices.generate(DOMAIN, 2, Set.of());
        List<List<Integer>> vector = choices.valid().get(0);
        assertThrows(UnsupportedOperationException.class, () -> vector.set(0, List.of(2)));
        assertThrows(UnsupportedOperationException.class, () -> vector.get(1).clear());
        assertArrayEquals(new int[]{0, 0}, choices.first());
        assertTrue(choices.isValid(2, 2));
    }
}
