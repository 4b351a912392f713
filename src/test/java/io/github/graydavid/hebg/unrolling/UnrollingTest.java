package io.github.graydavid.hebg.unrolling;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import io.github.graydavid.hebg.core.Action;
import io.github.graydavid.hebg.core.Behavior;
import io.github.graydavid.hebg.core.BehaviorGraph;
import io.github.graydavid.hebg.core.BehaviorRegistry;
import io.github.graydavid.hebg.core.EmptyNode;
import io.github.graydavid.hebg.core.FeatureCondition;
import io.github.graydavid.hebg.core.Node;
import io.github.graydavid.hebg.core.NodeKind;
import io.github.graydavid.hebg.core.TestData;
import io.github.graydavid.hebg.core.TestData.AxeLibrary;
import io.github.graydavid.hebg.core.TestData.ReportExample;

public class UnrollingTest {
    private final ReportExample report = new ReportExample();
    private final UnrollOptions cutting = UnrollOptions.builder().cutLoopingAlternatives(true).build();

    private static List<String> nodeNames(BehaviorGraph<?, ?> graph) {
        return graph.getNodes().stream().map(Node::getName).collect(Collectors.toList());
    }

    private static List<String> edgeStrings(BehaviorGraph<?, ?> graph) {
        return graph.getEdges().stream().map(Object::toString).collect(Collectors.toList());
    }

    @Test
    public void unrollThrowsExceptionGivenNullArguments() {
        assertThrows(NullPointerException.class, () -> Unrolling.unroll(report.behavior0.getGraph(), null));
    }

    @Test
    public void graphsWithoutBehaviorsAreAlreadyUnrolled() {
        UnrolledGraph<Integer, Integer> unrolled = Unrolling.unroll(report.behavior0.getGraph());

        assertThat(nodeNames(unrolled.getGraph()), is(nodeNames(report.behavior0.getGraph())));
        assertThat(edgeStrings(unrolled.getGraph()), is(edgeStrings(report.behavior0.getGraph())));
        assertThat(unrolled.isLooping(), is(false));
    }

    @Test
    public void nestedBehaviorsAreReplacedByTheirPrefixedGraphs() {
        UnrolledGraph<Integer, Integer> unrolled = Unrolling.unroll(report.behavior1.getGraph());

        assertThat(nodeNames(unrolled.getGraph()),
                contains("feature 1", "feature 2", "Action(0)", "Action(2)", "behavior 0>feature 0",
                        "behavior 0>Action(0)", "behavior 0>Action(1)"));
        assertThat(edgeStrings(unrolled.getGraph()),
                containsInAnyOrder("{feature 1}-1->{feature 2}", "{feature 1}-0->{behavior 0>feature 0}",
                        "{feature 2}-0->{Action(0)}", "{feature 2}-1->{Action(2)}",
                        "{behavior 0>feature 0}-0->{behavior 0>Action(0)}",
                        "{behavior 0>feature 0}-1->{behavior 0>Action(1)}"));
        assertThat(unrolled.isLooping(), is(false));
        assertThat(unrolled.getGraph().getBehavior(), is(report.behavior1));
    }

    @Test
    public void unrollingLeavesTheInputUntouched() {
        Set<Node<Integer, Integer>> before = report.behavior1.getGraph().getNodes();

        Unrolling.unroll(report.behavior1.getGraph());

        assertThat(report.behavior1.getGraph().getNodes(), is(before));
        assertThat(report.behavior1.getGraph().contains(report.behavior0), is(true));
    }

    @Test
    public void deeplyNestedBehaviorsGetOnePrefixPerLevel() {
        BehaviorGraph<Integer, Integer> unrolled = Unrolling.unroll(report.behavior2.getGraph()).getGraph();

        assertThat(unrolled.getNodes().size(), is(14));
        assertThat(nodeNames(unrolled), hasItem("behavior 1>behavior 0>feature 0"));
        assertThat(nodeNames(unrolled), not(hasItem("behavior 1")));
        assertThat(nodeNames(unrolled), not(hasItem("behavior 0")));
        assertThat(edgeStrings(unrolled), hasItem("{feature 4}-1->{behavior 1>feature 1}"));
        assertThat(edgeStrings(unrolled), hasItem("{feature 5}-0->{behavior 1>feature 1}"));
        assertThat(edgeStrings(unrolled), hasItem("{feature 5}-1->{behavior 0>feature 0}"));
        assertThat(edgeStrings(unrolled),
                hasItem("{behavior 1>feature 1}-0->{behavior 1>behavior 0>feature 0}"));
    }

    @Test
    public void unrollingAnUnrolledGraphChangesNothing() {
        BehaviorGraph<Integer, Integer> once = Unrolling.unroll(report.behavior2.getGraph()).getGraph();

        UnrolledGraph<Integer, Integer> twice = Unrolling.unroll(once);

        assertThat(nodeNames(twice.getGraph()), is(nodeNames(once)));
        assertThat(edgeStrings(twice.getGraph()), is(edgeStrings(once)));
        assertThat(twice.isLooping(), is(false));
        assertThat(twice.getGraph().getNodes().stream().filter(node -> node.getKind() == NodeKind.BEHAVIOR).count(),
                is(0L));
    }

    @Test
    public void unrollingAnUnrolledLoopingGraphKeepsTheSameLeaves() {
        AxeLibrary library = new AxeLibrary();
        BehaviorGraph<Set<String>, String> once = Unrolling.unroll(library.getNewAxe.getGraph()).getGraph();

        UnrolledGraph<Set<String>, String> twice = Unrolling.unroll(once);

        assertThat(nodeNames(twice.getGraph()), is(nodeNames(once)));
        assertThat(edgeStrings(twice.getGraph()), is(edgeStrings(once)));
        assertThat(twice.isLooping(), is(true));
    }

    @Test
    public void unrolledGraphsChooseTheSameActionsAsTheOriginals() {
        BehaviorGraph<Integer, Integer> unrolled = Unrolling.unroll(report.behavior2.getGraph()).getGraph();

        for (int observation = 0; observation < 60; ++observation) {
            assertThat(unrolled.call(observation), is(report.behavior2.call(observation)));
        }
    }

    @Test
    public void prefixesCanBeTurnedOff() {
        UnrollOptions options = UnrollOptions.builder().addPrefix(false).build();

        BehaviorGraph<Integer, Integer> unrolled = Unrolling.unroll(report.behavior1.getGraph(), options).getGraph();

        assertThat(nodeNames(unrolled),
                contains("feature 1", "feature 2", "Action(0)", "Action(2)", "feature 0", "Action(1)"));
        assertThat(edgeStrings(unrolled), hasItem("{feature 1}-0->{feature 0}"));
        assertThat(edgeStrings(unrolled), hasItem("{feature 0}-0->{Action(0)}"));
    }

    @Test
    public void separatorCanBeCustomized() {
        UnrollOptions options = UnrollOptions.builder().separator("/").build();

        BehaviorGraph<Integer, Integer> unrolled = Unrolling.unroll(report.behavior1.getGraph(), options).getGraph();

        assertThat(nodeNames(unrolled), hasItem("behavior 0/feature 0"));
    }

    @Test
    public void singleNodeGraphsAreInlinedWithoutPrefix() {
        Behavior<Integer, Integer> single = Behavior.of("single",
                self -> BehaviorGraph.builder(self).addNode(Action.of(7)).build());
        FeatureCondition<Integer, Integer> positive = TestData.greaterOrEqualTo(0);
        BehaviorGraph<Integer, Integer> graph = BehaviorGraph.builder(Behavior.<Integer, Integer>reference("host"))
                .addEdge(positive, single, 1)
                .addEdge(positive, Action.of(0), 0)
                .build();

        BehaviorGraph<Integer, Integer> unrolled = Unrolling.unroll(graph).getGraph();

        assertThat(nodeNames(unrolled), contains("Greater or equal to 0 ?", "Action(0)", "Action(7)"));
        assertThat(edgeStrings(unrolled), hasItem("{Greater or equal to 0 ?}-1->{Action(7)}"));
    }

    @Test
    public void unresolvableBehaviorsStayAsLeaves() {
        FeatureCondition<Integer, Integer> positive = TestData.greaterOrEqualTo(0);
        BehaviorGraph<Integer, Integer> graph = BehaviorGraph.builder(Behavior.<Integer, Integer>reference("host"))
                .addEdge(positive, Behavior.reference("missing"), 1)
                .addEdge(positive, Action.of(0), 0)
                .build();

        UnrolledGraph<Integer, Integer> unrolled = Unrolling.unroll(graph);

        assertThat(nodeNames(unrolled.getGraph()), contains("Greater or equal to 0 ?", "missing", "Action(0)"));
        assertThat(unrolled.isLooping(), is(false));
    }

    @Test
    public void loopingBehaviorsStayAsLeavesByDefault() {
        AxeLibrary library = new AxeLibrary();

        UnrolledGraph<Set<String>, String> unrolled = Unrolling.unroll(library.getNewAxe.getGraph());

        assertThat(nodeNames(unrolled.getGraph()),
                contains("Has wood ?", "Action(Summon axe out of thin air)", "Action(Craft axe)",
                        "Gather wood>Has axe ?", "Gather wood>Action(Punch tree)", "Gather wood>Get new axe",
                        "Gather wood>Action(Use axe on tree)"));
        assertThat(edgeStrings(unrolled.getGraph()), hasItem("{Has wood ?}-0->{Gather wood>Has axe ?}"));
        assertThat(unrolled.isLooping(), is(true));
    }

    @Test
    public void loopingBehaviorsCanBeCut() {
        AxeLibrary library = new AxeLibrary();

        UnrolledGraph<Set<String>, String> unrolled = Unrolling.unroll(library.getNewAxe.getGraph(), cutting);

        assertThat(nodeNames(unrolled.getGraph()),
                contains("Has wood ?", "Action(Summon axe out of thin air)", "Action(Craft axe)",
                        "Gather wood>Has axe ?", "Gather wood>Action(Punch tree)",
                        "Gather wood>Action(Use axe on tree)"));
        assertThat(unrolled.isLooping(), is(true));
    }

    @Test
    public void cutGraphsStillChooseActions() {
        AxeLibrary library = new AxeLibrary();

        BehaviorGraph<Set<String>, String> unrolled = Unrolling.unroll(library.gatherWood.getGraph(), cutting)
                .getGraph();

        assertThat(nodeNames(unrolled),
                contains("Has axe ?", "Action(Punch tree)", "Action(Use axe on tree)", "Get new axe>Has wood ?",
                        "Get new axe>Action(Summon axe out of thin air)", "Get new axe>Action(Craft axe)"));
        assertThat(unrolled.call(Set.of()), is("Punch tree"));
        assertThat(unrolled.call(Set.of("axe")), is("Use axe on tree"));
    }

    @Test
    public void cuttingRemovesBranchesThatBecomeImpossible() {
        BehaviorRegistry<Integer, String> registry = new BehaviorRegistry<>();
        Behavior<Integer, String> walk = Behavior.of("Walk", self -> {
            FeatureCondition<Integer, String> isFar = FeatureCondition.ofPredicate("Is far ?",
                    distance -> distance > 10);
            return BehaviorGraph.builder(self, registry)
                    .addEdge(isFar, Behavior.reference("Walk"), 1)
                    .addEdge(isFar, Action.of("stop"), 0)
                    .build();
        });
        registry.register(walk);

        UnrolledGraph<Integer, String> unrolled = Unrolling.unroll(walk.getGraph(), cutting);

        assertThat(unrolled.getGraph().getNodes(), empty());
        assertThat(unrolled.isLooping(), is(true));
    }

    @Test
    public void cuttingKeepsEmptyNodesThatHaveOtherAlternatives() {
        BehaviorRegistry<Integer, String> registry = new BehaviorRegistry<>();
        Behavior<Integer, String> walk = Behavior.of("Walk", self -> {
            FeatureCondition<Integer, String> isFar = FeatureCondition.ofPredicate("Is far ?",
                    distance -> distance > 10);
            return BehaviorGraph.builder(self, registry)
                    .addEdge(isFar, Behavior.reference("Walk"), 1)
                    .addEdge(isFar, Action.of("stop"), 0)
                    .build();
        });
        Behavior<Integer, String> run = Behavior.of("Run", self -> {
            EmptyNode<Integer, String> choose = EmptyNode.named("Choose");
            return BehaviorGraph.builder(self, registry)
                    .addEdge(choose, Behavior.reference("Walk"), 0)
                    .addEdge(choose, Action.of("Sprint"), 0)
                    .build();
        });
        registry.register(walk).register(run);

        UnrolledGraph<Integer, String> unrolled = Unrolling.unroll(run.getGraph(), cutting);

        assertThat(nodeNames(unrolled.getGraph()), contains("Choose", "Action(Sprint)"));
        assertThat(edgeStrings(unrolled.getGraph()), contains("{Choose}-0->{Action(Sprint)}"));
        assertThat(unrolled.isLooping(), is(true));
    }
}
