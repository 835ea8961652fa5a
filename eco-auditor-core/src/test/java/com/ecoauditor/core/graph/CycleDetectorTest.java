package com.ecoauditor.core.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

class CycleDetectorTest {

    @Test
    void findCycles_acyclicGraph_returnsNothing() {
        // Given
        Map<String, SortedSet<String>> adjacency = Map.of(
            "a", new TreeSet<>(List.of("b", "c")),
            "b", new TreeSet<>(List.of("c"))
        );

        // When
        List<List<String>> cycles = CycleDetector.findCycles(nodes("a", "b", "c"), adjacency);

        // Then
        assertThat(cycles).isEmpty();
    }

    @Test
    void findCycles_triangle_reportsOneCycleStartingAtSmallestMember() {
        // Given
        Map<String, SortedSet<String>> adjacency = Map.of(
            "x", new TreeSet<>(List.of("y")),
            "y", new TreeSet<>(List.of("z")),
            "z", new TreeSet<>(List.of("x"))
        );

        // When
        List<List<String>> cycles = CycleDetector.findCycles(nodes("x", "y", "z"), adjacency);

        // Then
        assertThat(cycles).containsExactly(List.of("x", "y", "z"));
    }

    @Test
    void findCycles_overlappingCycles_reportsEveryMemberSetWhateverTheNaming() {
        // Given: a -> {b, c}, b -> c, c -> a holds the loops {a, b, c} and {a, c}
        Map<String, SortedSet<String>> original = Map.of(
            "a", new TreeSet<>(List.of("b", "c")),
            "b", new TreeSet<>(List.of("c")),
            "c", new TreeSet<>(List.of("a"))
        );
        Map<String, SortedSet<String>> renamed = Map.of(
            "z", new TreeSet<>(List.of("b", "c")),
            "b", new TreeSet<>(List.of("c")),
            "c", new TreeSet<>(List.of("z"))
        );

        // When
        List<List<String>> originalCycles = CycleDetector.findCycles(nodes("a", "b", "c"), original);
        List<List<String>> renamedCycles = CycleDetector.findCycles(nodes("b", "c", "z"), renamed);

        // Then
        assertThat(memberSets(originalCycles)).containsExactlyInAnyOrder(
            nodes("a", "b", "c"), nodes("a", "c"));
        assertThat(memberSets(renamedCycles)).containsExactlyInAnyOrder(
            nodes("b", "c", "z"), nodes("c", "z"));
    }

    @Test
    void findCycles_completeGraph_reportsEachMemberSetOnce() {
        // Given
        Map<String, SortedSet<String>> adjacency = Map.of(
            "a", new TreeSet<>(List.of("b", "c")),
            "b", new TreeSet<>(List.of("a", "c")),
            "c", new TreeSet<>(List.of("a", "b"))
        );

        // When
        List<List<String>> cycles = CycleDetector.findCycles(nodes("a", "b", "c"), adjacency);

        // Then
        assertThat(memberSets(cycles)).containsExactlyInAnyOrder(
            nodes("a", "b"), nodes("a", "b", "c"), nodes("a", "c"), nodes("b", "c"));
    }

    @Test
    void findCycles_cycleReachedOnlyThroughFinishedNodes_isStillFound() {
        // Given: d is explored from a before the d <-> e loop is closed from e's side
        Map<String, SortedSet<String>> adjacency = Map.of(
            "a", new TreeSet<>(List.of("d")),
            "d", new TreeSet<>(List.of("e")),
            "e", new TreeSet<>(List.of("d", "f")),
            "f", new TreeSet<>(List.of("a"))
        );

        // When
        List<List<String>> cycles = CycleDetector.findCycles(nodes("a", "d", "e", "f"), adjacency);

        // Then
        assertThat(cycles).containsExactly(List.of("a", "d", "e", "f"), List.of("d", "e"));
    }

    @Test
    void findCycles_twoDisjointCycles_reportsBoth() {
        // Given
        Map<String, SortedSet<String>> adjacency = Map.of(
            "a", new TreeSet<>(List.of("b")),
            "b", new TreeSet<>(List.of("a")),
            "c", new TreeSet<>(List.of("d")),
            "d", new TreeSet<>(List.of("c"))
        );

        // When
        List<List<String>> cycles = CycleDetector.findCycles(nodes("a", "b", "c", "d"), adjacency);

        // Then
        assertThat(cycles).containsExactly(List.of("a", "b"), List.of("c", "d"));
    }

    @Test
    void dependencyCycle_rotatesPathToSmallestMember() {
        DependencyCycle cycle = new DependencyCycle(List.of("gate", "core", "studio"), true);

        assertThat(cycle.path()).containsExactly("core", "studio", "gate");
        assertThat(cycle.describe()).isEqualTo("core -> studio -> gate -> core");
    }

    private static List<SortedSet<String>> memberSets(List<List<String>> cycles) {
        return cycles.stream().<SortedSet<String>>map(TreeSet::new).toList();
    }

    private static SortedSet<String> nodes(String... names) {
        return new TreeSet<>(List.of(names));
    }
}
