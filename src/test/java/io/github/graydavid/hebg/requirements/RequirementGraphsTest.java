package io.github.graydavid.hebg.requirements;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import io.github.graydavid.hebg.core.Action;
import io.github.graydavid.hebg.core.Behavior;
import io.github.graydavid.hebg.core.BehaviorGraph;
import io.github.graydavid.hebg.core.CyclicStructureException;
import io.github.graydavid.hebg.core.EmptyNode;
import io.github.graydavid.hebg.core.FeatureCondition;
import io.github.graydavid.hebg.core.TestData.AxeLibrary;
import io.github.graydavid.hebg.core.TestData.ReportExample;
import io.github.graydavid.hebg.core.UnresolvedBehaviorException;

public class RequirementGraphsTest {
    private final ReportExample report = new ReportExample();

    private static List<String> edgeStrings(RequirementGraph<?, ?> graph) {
        return graph.getEdges().stream().map(Object::toString).collect(Collectors.toList());
    }

    @Test
    public void behaviorsRequireTheBehaviorsInTheirGraphs() {
        RequirementGraph<Integer, Integer> graph = RequirementGraphs.build(report.behaviors());

        assertThat(graph.getNodes(), contains(report.behavior0, report.behavior1, report.behavior2));
        assertThat(edgeStrings(graph), contains("{behavior 0}-1->{behavior 1}", "{behavior 0}-2->{behavior 2}",
                "{behavior 1}-1->{behavior 2}"));
        assertThat(graph.hasEdge(report.behavior0, report.behavior1), is(true));
        assertThat(graph.hasEdge(report.behavior1, report.behavior0), is(false));
    }

    @Test
    public void requirementsAndDependentsFollowTheEdges() {
        RequirementGraph<Integer, Integer> graph = RequirementGraphs.build(report.behaviors());

        assertThat(graph.getRequirementsOf(report.behavior2), contains(report.behavior1, report.behavior0));
        assertThat(graph.getRequirementsOf(report.behavior0), empty());
        assertThat(graph.getDependentsOf(report.behavior0), contains(report.behavior1, report.behavior2));
    }

    @Test
    public void levelsCountTheRequirementsToWaitFor() {
        RequirementGraph<Integer, Integer> graph = RequirementGraphs.build(report.behaviors());

        assertThat(graph.getLevel(report.behavior0), is(0));
        assertThat(graph.getLevel(report.behavior1), is(1));
        assertThat(graph.getLevel(report.behavior2), is(2));
        assertThat(graph.getLevels().getDepth(), is(3));
    }

    @Test
    public void levelsWaitForEveryRequirementEvenWhenEachIsItsRequirementsFirstDependent() {
        FeatureCondition<Integer, String> hasWood = FeatureCondition.ofPredicate("Has wood ?", wood -> wood > 0);
        FeatureCondition<Integer, String> hasHouse = FeatureCondition.ofPredicate("Has house ?", houses -> houses > 0);
        Behavior<Integer, String> gather = Behavior.of("Gather",
                self -> BehaviorGraph.builder(self).addNode(Action.of("gather")).build());
        Behavior<Integer, String> explore = Behavior.of("Explore",
                self -> BehaviorGraph.builder(self).addNode(Action.of("explore")).build());
        Behavior<Integer, String> build = Behavior.of("Build", self -> BehaviorGraph.builder(self)
                .addEdge(hasWood, Behavior.reference("Gather"), 0)
                .addEdge(hasWood, Action.of("build"), 1)
                .build());
        Behavior<Integer, String> settle = Behavior.of("Settle", self -> BehaviorGraph.builder(self)
                .addEdge(hasHouse, Behavior.reference("Explore"), 0)
                .addEdge(hasHouse, Behavior.reference("Build"), 1)
                .build());

        RequirementGraph<Integer, String> graph = RequirementGraphs.build(List.of(gather, explore, build, settle));

        assertThat(edgeStrings(graph), contains("{Gather}-1->{Build}", "{Explore}-1->{Settle}", "{Build}-1->{Settle}"));
        assertThat(graph.getLevel(explore), is(0));
        assertThat(graph.getLevel(gather), is(0));
        assertThat(graph.getLevel(build), is(1));
        assertThat(graph.getLevel(settle), is(2));
    }

    @Test
    public void unknownBehaviorsAreRejected() {
        RequirementGraph<Integer, Integer> graph = RequirementGraphs.build(List.of(report.behavior0));

        assertThrows(IllegalArgumentException.class, () -> graph.getRequirementsOf(report.behavior2));
    }

    @Test
    public void requirementsOutsideTheListAreAddedAsNodes() {
        Behavior<Integer, String> craft = Behavior.of("Craft table", self -> BehaviorGraph.builder(self)
                .addEdge(FeatureCondition.ofPredicate("Has planks ?", planks -> planks > 0),
                        Behavior.reference("Get planks"), 0)
                .build());

        RequirementGraph<Integer, String> graph = RequirementGraphs.build(List.of(craft));

        assertThat(edgeStrings(graph), contains("{Get planks}-1->{Craft table}"));
        assertThat(graph.getLevel(Behavior.reference("Get planks")), is(0));
        assertThat(graph.getLevel(craft), is(1));
    }

    @Test
    public void behaviorsOnlyReachedThroughAlternativesToEmptyNodesAreNotRequired() {
        Behavior<Integer, String> craft = Behavior.of("Craft table", self -> {
            EmptyNode<Integer, String> anyway = EmptyNode.named("Anyway");
            FeatureCondition<Integer, String> hasPlanks = FeatureCondition.ofPredicate("Has planks ?",
                    planks -> planks > 0);
            Action<Integer, String> craftTable = Action.of("craft");
            return BehaviorGraph.builder(self)
                    .addEdge(anyway, craftTable, 0)
                    .addEdge(hasPlanks, craftTable, 0)
                    .addEdge(hasPlanks, Behavior.reference("Get planks"), 1)
                    .build();
        });

        RequirementGraph<Integer, String> graph = RequirementGraphs.build(List.of(craft));

        assertThat(graph.getNodes(), contains(craft));
        assertThat(graph.getEdges(), empty());
        assertThat(graph.getLevel(craft), is(0));
    }

    @Test
    public void mutuallyRequiringBehaviorsAreRejected() {
        AxeLibrary library = new AxeLibrary();

        assertThrows(CyclicStructureException.class,
                () -> RequirementGraphs.build(List.of(library.gatherWood, library.getNewAxe)));
    }

    @Test
    public void behaviorsThatCantBuildTheirGraphsAreRejected() {
        UnresolvedBehaviorException exception = assertThrows(UnresolvedBehaviorException.class,
                () -> RequirementGraphs.build(List.of(report.behavior0, Behavior.reference("missing"))));

        assertThat(exception.getBehaviorName(), is("missing"));
    }
}
