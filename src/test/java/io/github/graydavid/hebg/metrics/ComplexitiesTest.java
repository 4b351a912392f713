package io.github.graydavid.hebg.metrics;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.graydavid.hebg.core.Behavior;
import io.github.graydavid.hebg.core.TestData.ReportExample;

public class ComplexitiesTest {
    private final ReportExample report = new ReportExample();
    private Map<Behavior<Integer, Integer>, Histogram<Integer, Integer>> histograms;

    @BeforeEach
    public void computeHistograms() {
        histograms = Histograms.ofBehaviors(report.behaviors());
    }

    @Test
    public void learningComplexityWithoutReuseSavesNothing() {
        ComplexityResult result = Complexities.learningComplexity(report.behavior0, histograms);

        assertThat(result, is(new ComplexityResult(3, 0)));
    }

    @Test
    public void learningComplexitySavesReusedActions() {
        ComplexityResult result = Complexities.learningComplexity(report.behavior1, histograms);

        assertThat(result, is(new ComplexityResult(6, 1)));
    }

    @Test
    public void learningComplexitySavesReusedBehaviors() {
        ComplexityResult result = Complexities.learningComplexity(report.behavior2, histograms);

        assertThat(result, is(new ComplexityResult(9, 12)));
    }

    @Test
    public void learningComplexityDependsOnlyOnHistogramContents() {
        Map<Behavior<Integer, Integer>, Histogram<Integer, Integer>> explicit = new LinkedHashMap<>();
        explicit.put(report.behavior0, Histogram.of(report.actions.get(0), 1)
                .plus(report.actions.get(1), 1)
                .plus(report.features.get(0), 1));
        explicit.put(report.behavior1, Histogram.of(report.actions.get(0), 1)
                .plus(report.actions.get(2), 1)
                .plus(report.behavior0, 1)
                .plus(report.features.get(1), 1)
                .plus(report.features.get(2), 1));
        explicit.put(report.behavior2, Histogram.of(report.actions.get(0), 1)
                .plus(report.behavior0, 1)
                .plus(report.behavior1, 2)
                .plus(report.features.get(3), 1)
                .plus(report.features.get(4), 1)
                .plus(report.features.get(5), 1));

        assertThat(Complexities.learningComplexity(report.behavior0, explicit), is(new ComplexityResult(3, 0)));
        assertThat(Complexities.learningComplexity(report.behavior1, explicit), is(new ComplexityResult(6, 1)));
        assertThat(Complexities.learningComplexity(report.behavior2, explicit), is(new ComplexityResult(9, 12)));
    }

    @Test
    public void previouslyUsedNodesAreSaved() {
        Histogram<Integer, Integer> previouslyUsed = Histogram.of(report.actions.get(0), 1)
                .plus(report.actions.get(1), 1);

        ComplexityResult result = Complexities.learningComplexity(report.behavior0, histograms, previouslyUsed);

        assertThat(result, is(new ComplexityResult(1, 2)));
    }

    @Test
    public void learningComplexitiesAccumulateEarlierBehaviors() {
        Map<Behavior<Integer, Integer>, ComplexityResult> results = Complexities
                .learningComplexities(List.of(report.behavior0, report.behavior1), histograms);

        assertThat(results.keySet(), contains(report.behavior0, report.behavior1));
        assertThat(results.get(report.behavior0), is(new ComplexityResult(3, 0)));
        assertThat(results.get(report.behavior1), is(new ComplexityResult(3, 4)));
    }

    @Test
    public void generalComplexityUsesTheGivenFunctions() {
        ComplexityResult result = Complexities.generalComplexity(report.behavior1, histograms,
                (node, used, previouslyUsed) -> 0, (node, used) -> used, Histogram.empty());

        assertThat(result, is(new ComplexityResult(7, 0)));
    }

    @Test
    public void behaviorsWithoutHistogramsAreKeptAsLeaves() {
        Map<Behavior<Integer, Integer>, Histogram<Integer, Integer>> onlyBehavior1 = Map.of(report.behavior1,
                histograms.get(report.behavior1));

        ComplexityResult result = Complexities.generalComplexity(report.behavior1, onlyBehavior1,
                (node, used, previouslyUsed) -> 0, (node, used) -> used, Histogram.empty());

        assertThat(result, is(new ComplexityResult(5, 0)));
    }

    @Test
    public void missingHistogramIsRejected() {
        Map<Behavior<Integer, Integer>, Histogram<Integer, Integer>> onlyBehavior0 = Map.of(report.behavior0,
                histograms.get(report.behavior0));

        assertThrows(IllegalArgumentException.class,
                () -> Complexities.learningComplexity(report.behavior1, onlyBehavior0));
    }
}
