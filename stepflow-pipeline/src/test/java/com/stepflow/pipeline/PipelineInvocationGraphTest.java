package com.stepflow.pipeline;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineInvocationGraphTest {

    @AfterEach
    void closeActiveBuild() {
        PipelineBuild.active().ifPresent(PipelineBuild::close);
    }

    private static StepTemplate describe(String name) {
        return StepTemplate.builder(new PipelineSteps.Describe()).name(name).build();
    }

    @Test
    void nodes_areInTopologicalOrder() {
        StepTemplate first = describe("first");
        StepTemplate second = describe("second");
        StepTemplate third = describe("third");
        third.after(second);
        second.after(first);

        PipelineInvocationGraph graph = PipelineBuild.build("order", null, build -> {
            third.call(build, Map.of());
            second.call(build, Map.of());
            first.call(build, Map.of());
        });

        assertEquals(List.of("first", "second", "third"), graph.getInvocationIds());
    }

    @Test
    void independentNodes_keepRegistrationOrder() {
        PipelineInvocationGraph graph = PipelineBuild.build("independent", null, build -> {
            describe("b").call(build, Map.of());
            describe("a").call(build, Map.of());
        });

        assertEquals(List.of("b", "a"), graph.getInvocationIds());
    }

    @Test
    void orderingHintsClosingACycleFail() {
        StepTemplate a = describe("a");
        StepTemplate b = describe("b");
        a.after(b);
        b.after(a);

        CyclicDependencyException e = assertThrows(CyclicDependencyException.class,
                () -> PipelineBuild.build("cycle", null, build -> {
                    a.call(build, Map.of());
                    b.call(build, Map.of());
                }));
        assertEquals(List.of("a", "b"), e.getInvocationIds());
        assertFalse(PipelineBuild.active().isPresent());
    }

    @Test
    void getNode_unknownIdFails() {
        PipelineInvocationGraph graph = PipelineBuild.build("lookup", null, build -> describe("only").call(build, Map.of()));

        assertTrue(graph.contains("only"));
        assertThrows(IllegalArgumentException.class, () -> graph.getNode("other"));
    }

    @Test
    void graph_isImmutable() {
        PipelineInvocationGraph graph = PipelineBuild.build("immutable", null, build -> describe("only").call(build, Map.of()));

        assertThrows(UnsupportedOperationException.class, () -> graph.getNodes().clear());
        assertThrows(UnsupportedOperationException.class, () -> graph.getNode("only").upstream().add("x"));
    }

    @Test
    void graph_listParameterIsImmutable() {
        StepTemplate train = StepTemplate.of(new PipelineSteps.Train());
        List<Integer> data = new ArrayList<>(List.of(1, 2, 3));

        PipelineInvocationGraph graph = PipelineBuild.build("list-parameter", null,
                build -> train.call(build, Map.of("data", data, "epochs", 2)));
        data.add(4);

        @SuppressWarnings("unchecked")
        List<Object> finalized = (List<Object>) graph.getNode("train").configuration().getParameters().get("data");
        assertEquals(List.of(1, 2, 3), finalized);
        assertThrows(UnsupportedOperationException.class, () -> finalized.add(99));
    }
}
