package com.mwpbound.analyzer;

import com.mwpbound.analyzer.relation.DeltaGraph;
import com.mwpbound.analyzer.relation.Relation;
import com.mwpbound.analyzer.relation.RelationList;
import com.mwpbound.analyzer.relation.SimpleRelation;
import com.mwpbound.analyzer.semiring.Polynomial;
import com.mwpbound.analyzer.semiring.Scalar;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RelationTest {

    private static final List<Integer> DOMAIN = List.of(0, 1, 2);

    /** Relation of {@code x = x + y} at choice point 0. */
    private static Relation accumulate() {
        Polynomial[][] m = {
            {Polynomial.fromScalars(0, Scalar.M, Scalar.P, Scalar.W), Polynomial.ZERO},
            {Polynomial.fromScalars(0, Scalar.P, Scalar.M, Scalar.W), Polynomial.UNIT},
        };
        return new Relation(List.of("x", "y"), m);
    }

    @Test
    void identityIsNeutralForComposition() {
        Relation r = accumulate();
        assertEquals(r, Relation.identity(r.variables()).composition(r));
        assertEquals(r, r.composition(Relation.identity(r.variables())));
    }

    @Test
    void homogeniseMapsNewVariablesToThemselves() {
        Relation r = accumulate().homogenise(List.of("x", "y", "z"));
        assertEquals(List.of("x", "y", "z"), r.variables());
        assertEquals(Polynomial.UNIT, r.flow("z", "z"));
        assertEquals(Polynomial.ZERO, r.flow("z", "x"));
        assertEquals(Polynomial.ZERO, r.flow("x", "z"));
        assertEquals(accumulate().flow("y", "x"), r.flow("y", "x"));
    }

    @Test
    void homogeniseRejectsMissingVariables() {
        assertThrows(IllegalArgumentException.class, () -> accumulate().homogenise(List.of("x")));
    }

    @Test
    void compositionFollowsDataFlow() {
        // x = y; then y = 0
        Relation copy = Relation.identity(List.of("x", "y"))
            .replaceColumn(List.of(Polynomial.ZERO, Polynomial.UNIT), "x");
        Relation reset = new Relation(List.of("y"));

        Relation r = copy.composition(reset);
        assertEquals(Polynomial.UNIT, r.flow("y", "x"));
        assertEquals(Polynomial.ZERO, r.flow("x", "x"));
        assertEquals(Polynomial.ZERO, r.flow("y", "y"));
    }

    @Test
    void sumJoinsRelationsOverDifferentVariables() {
        Relation a = Relation.identity(List.of("x", "y"))
            .replaceColumn(List.of(Polynomial.ZERO, Polynomial.UNIT), "x");
        Relation b = Relation.identity(List.of("x", "z"))
            .replaceColumn(List.of(Polynomial.ZERO, Polynomial.UNIT), "x");

        Relation sum = a.sum(b);
        assertEquals(List.of("x", "y", "z"), sum.variables());
        assertEquals(Polynomial.UNIT, sum.flow("y", "x"));
        assertEquals(Polynomial.UNIT, sum.flow("z", "x"));
        // each side leaves the other's variable unchanged
        assertEquals(Polynomial.UNIT, sum.flow("z", "z"));
        assertEquals(Polynomial.ZERO, sum.flow("x", "x"));
    }

    @Test
    void fixpointIsReflexiveTransitiveClosure() {
        Relation fix = accumulate().fixpoint();
        assertEquals("m+p.delta(1,0)+w.delta(2,0)", fix.flow("x", "x").toString());
        assertEquals("p.delta(0,0)+p.delta(1,0)+w.delta(2,0)", fix.flow("y", "x").toString());
        assertEquals(Polynomial.UNIT, fix.flow("y", "y"));
        assertEquals(Polynomial.ZERO, fix.flow("x", "y"));
    }

    @Test
    void whileCorrectionMakesSelfGrowthInfinite() {
        DeltaGraph graph = new DeltaGraph(DOMAIN);
        Relation r = accumulate().fixpoint().whileCorrection(graph);

        assertEquals("m+i.delta(1,0)+i.delta(2,0)", r.flow("x", "x").toString());
        assertEquals("i.delta(0,0)+i.delta(1,0)+w.delta(2,0)", r.flow("y", "x").toString());
        assertEquals(3, graph.size());
        graph.fusion();
        assertTrue(graph.isFull());
        assertTrue(r.eval(DOMAIN, 1).isInfinite());
        assertEquals(List.of("x ➔ x", "y ➔ x"), r.infinityFlows(List.of("x", "y")));
    }

    @Test
    void loopCorrectionAddsIterationCountToPolynomialFlows() {
        DeltaGraph graph = new DeltaGraph(DOMAIN);
        Relation body = accumulate().homogenise(List.of("n", "x", "y"));
        Relation r = body.fixpoint().loopCorrection("n", graph);

        assertEquals("m+i.delta(1,0)+i.delta(2,0)", r.flow("x", "x").toString());
        assertEquals("p.delta(0,0)+p.delta(1,0)", r.flow("n", "x").toString());
        assertEquals(Polynomial.UNIT, r.flow("n", "n"));
        graph.fusion();
        assertFalse(graph.isFull());

        assertEquals(List.of(List.of(List.of(0))), r.eval(DOMAIN, 1).valid());
        SimpleRelation chosen = r.applyChoice(new int[]{0});
        assertEquals(Scalar.P, chosen.flow("n", "x"));
        assertEquals(Scalar.M, chosen.flow("x", "x"));
        assertEquals(Scalar.P, chosen.flow("y", "x"));
    }

    @Test
    void varEvalCountsExtraScalarsAsFailures() {
        Relation r = accumulate();
        assertFalse(r.varEval(DOMAIN, 1, "x").isInfinite());
        // m needs choice 0 for x and choice 1 for y: no choice avoids both p
        assertTrue(r.varEval(DOMAIN, 1, "x", Scalar.W, Scalar.P).isInfinite());
        assertEquals(List.of(List.of(List.of(0, 1))), r.varEval(DOMAIN, 1, "x", Scalar.W).valid());
    }

    @Test
    void relationListRemovesDuplicates() {
        Relation r = accumulate();
        RelationList list = new RelationList(List.of(r, r));
        assertEquals(1, list.size());
        assertThrows(IllegalArgumentException.class, () -> new RelationList(List.of()));
    }

    @Test
    void emptyRelationListActsAsIdentity() {
        RelationList list = RelationList.empty();
        list.composition(RelationList.of(accumulate()));
        assertEquals(accumulate(), list.first());
    }

    @Test
    void rowsRenderPolynomials() {
        assertEquals(List.of(
            List.of("m.delta(0,0)+p.delta(1,0)+w.delta(2,0)", "0"),
            List.of("p.delta(0,0)+m.delta(1,0)+w.delta(2,0)", "m")), accumulate().rows());
    }
}
