package com.stepflow.pipeline;

import com.stepflow.artifacts.ArtifactRecord;
import com.stepflow.artifacts.ArtifactStoreMismatchException;
import com.stepflow.artifacts.ArtifactUploadContext;
import com.stepflow.artifacts.ExternalArtifact;
import com.stepflow.artifacts.InMemoryArtifactMetadataStore;
import com.stepflow.artifacts.LocalArtifactStore;
import com.stepflow.artifacts.RunContext;
import com.stepflow.artifacts.StepArtifact;
import com.stepflow.caching.CachingFingerprintCalculator;
import com.stepflow.config.StepflowConfig;
import com.stepflow.materializer.BuiltInMaterializer;
import com.stepflow.materializer.JsonContainerMaterializer;
import com.stepflow.materializer.MaterializerRequiredException;
import com.stepflow.stepconfig.ArtifactConfiguration;
import com.stepflow.stepconfig.Source;
import com.stepflow.stepconfig.StepConfiguration;
import com.stepflow.stepconfig.StepConfigurationUpdate;
import com.stepflow.stepinterface.DeclaredType;
import com.stepflow.stepinterface.StepInterfaceException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineBuildTest {

    @TempDir
    Path tempDir;

    private UUID storeId;
    private InMemoryArtifactMetadataStore metadataStore;
    private ArtifactUploadContext uploadContext;

    private StepTemplate load;
    private StepTemplate train;
    private StepTemplate report;

    @BeforeEach
    void setUp() {
        storeId = UUID.randomUUID();
        metadataStore = new InMemoryArtifactMetadataStore();
        uploadContext = ArtifactUploadContext.builder()
                .artifactStore(new LocalArtifactStore(storeId, tempDir))
                .metadataStore(metadataStore)
                .runContext(new RunContext(UUID.randomUUID(), UUID.randomUUID()))
                .config(StepflowConfig.builder().build())
                .build();
        load = StepTemplate.of(new PipelineSteps.Load());
        train = StepTemplate.of(new PipelineSteps.Train());
        report = StepTemplate.of(new PipelineSteps.Report());
    }

    @AfterEach
    void closeActiveBuild() {
        PipelineBuild.active().ifPresent(PipelineBuild::close);
    }

    @Test
    void addInvocation_suffixesRepeatedStepName() {
        try (PipelineBuild build = PipelineBuild.begin("suffix", null)) {
            assertEquals("load", load.call(build, Map.of()).getInvocationId());
            assertEquals("load_2", load.call(build, Map.of()).getInvocationId());
            assertEquals("load_3", load.call(build, Map.of()).getInvocationId());
        }
    }

    @Test
    void addInvocation_blankIdIsDerivedAndSuffixed() {
        try (PipelineBuild build = PipelineBuild.begin("blank", null)) {
            assertEquals("load", load.call(build, Map.of(), "", List.of()).getInvocationId());
            assertEquals("load_2", load.call(build, Map.of(), " ", List.of()).getInvocationId());
        }
    }

    @Test
    void addInvocation_duplicateCustomIdFails() {
        try (PipelineBuild build = PipelineBuild.begin("duplicate", null)) {
            load.call(build, Map.of(), "loader", List.of());

            DuplicateInvocationException e = assertThrows(DuplicateInvocationException.class,
                    () -> load.call(build, Map.of(), "loader", List.of()));
            assertEquals("loader", e.getInvocationId());
        }
    }

    @Test
    void addInvocation_unknownExplicitUpstreamFails() {
        try (PipelineBuild build = PipelineBuild.begin("upstream", null)) {
            InvalidUpstreamException e = assertThrows(InvalidUpstreamException.class,
                    () -> load.call(build, Map.of(), null, List.of("missing")));
            assertEquals("missing", e.getUpstreamId());
        }
    }

    @Test
    void addInvocation_artifactFromAnotherBuildFails() {
        StepArtifact foreign = new StepArtifact("load", "output", DeclaredType.ofClass(List.class));
        try (PipelineBuild build = PipelineBuild.begin("foreign", null)) {
            assertThrows(InvalidUpstreamException.class,
                    () -> train.call(build, Map.of("data", foreign, "epochs", 1)));
        }
    }

    @Test
    void call_rejectsUnknownInput() {
        try (PipelineBuild build = PipelineBuild.begin("unknown", null)) {
            assertThrows(StepInterfaceException.class, () -> load.call(build, Map.of("rows", 10)));
        }
    }

    @Test
    void call_rejectsArtifactOfIncompatibleType() {
        try (PipelineBuild build = PipelineBuild.begin("types", null)) {
            StepArtifact data = load.call(build, Map.of()).single();

            assertThrows(StepInterfaceException.class, () -> report.call(build, Map.of("score", data)));
        }
    }

    @Test
    void call_returnsOneArtifactPerOutput() {
        StepTemplate split = StepTemplate.of(new PipelineSteps.Split());
        try (PipelineBuild build = PipelineBuild.begin("outputs", null)) {
            StepArtifact data = load.call(build, Map.of()).single();
            InvocationOutputs outputs = split.call(build, Map.of("data", data));

            assertEquals(List.of("train", "test"), List.copyOf(outputs.asMap().keySet()));
            assertEquals(new StepArtifact("split", "test", outputs.get("test").declaredType()), outputs.get("test"));
            assertThrows(IllegalStateException.class, outputs::single);
        }
    }

    @Test
    void finalizeGraph_wiresArtifactProducerAsUpstream() {
        PipelineInvocationGraph graph = PipelineBuild.build("wiring", null, build -> {
            StepArtifact data = load.call(build, Map.of()).single();
            StepArtifact score = train.call(build, Map.of("data", data, "epochs", 2)).single();
            report.call(build, Map.of("score", score));
        });

        assertEquals(List.of("load", "train", "report"), graph.getInvocationIds());
        InvocationNode trainNode = graph.getNode("train");
        assertEquals(Set.of("load"), trainNode.upstream());
        assertEquals(Map.of("data", new InputBinding("load", "output")), trainNode.inputs());
        assertEquals(Set.of("train"), graph.getNode("report").upstream());
    }

    @Test
    void finalizeGraph_resolvesMaterializersAndFingerprint() {
        PipelineInvocationGraph graph = PipelineBuild.build("fingerprint", null, build -> {
            StepArtifact data = load.call(build, Map.of()).single();
            train.call(build, Map.of("data", data, "epochs", 2));
        });

        StepConfiguration loadConfig = graph.getNode("load").configuration();
        assertEquals(Map.of("output", new ArtifactConfiguration(List.of(Source.fromClass(JsonContainerMaterializer.class)))),
                loadConfig.getOutputs());
        StepConfiguration trainConfig = graph.getNode("train").configuration();
        assertEquals(List.of(Source.fromClass(BuiltInMaterializer.class)),
                trainConfig.getOutputs().get("output").getMaterializerSource());
        assertEquals(Map.of("epochs", 2), trainConfig.getParameters());
        assertEquals(List.of(CachingFingerprintCalculator.STEP_SOURCE_KEY, "output" + CachingFingerprintCalculator.MATERIALIZER_SOURCE_SUFFIX),
                List.copyOf(trainConfig.getCachingParameters().keySet()));
    }

    @Test
    void finalizeGraph_fingerprintIsStableAcrossBuilds() {
        PipelineInvocationGraph first = PipelineBuild.build("first", null, build -> load.call(build, Map.of()));
        PipelineInvocationGraph second = PipelineBuild.build("second", null, build -> load.call(build, Map.of()));

        assertEquals(first.getNode("load").configuration().getCachingParameters(),
                second.getNode("load").configuration().getCachingParameters());
    }

    @Test
    void finalizeGraph_missingInputFails() {
        try (PipelineBuild build = PipelineBuild.begin("missing", null)) {
            train.call(build, Map.of("epochs", 1));

            MissingInputException e = assertThrows(MissingInputException.class, build::finalizeGraph);
            assertEquals("data", e.getInputName());
            assertEquals("train", e.getStepName());
        }
    }

    @Test
    void finalizeGraph_anyTypedOutputRequiresMaterializer() {
        StepTemplate untyped = StepTemplate.of(new PipelineSteps.Untyped());

        assertThrows(MaterializerRequiredException.class,
                () -> PipelineBuild.build("untyped", null, build -> untyped.call(build, Map.of())));
    }

    @Test
    void finalizeGraph_artifactWinsOverConfiguredParameter() {
        train.configure(StepConfigurationUpdate.builder().parameter("data", List.of(9)).build());

        PipelineInvocationGraph graph = PipelineBuild.build("shadow", null, build -> {
            StepArtifact data = load.call(build, Map.of()).single();
            train.call(build, Map.of("data", data, "epochs", 1));
        });

        assertFalse(graph.getNode("train").configuration().getParameters().containsKey("data"));
    }

    @Test
    void orderingHint_addsUpstreamOfSingleInvocation() {
        StepTemplate describe = StepTemplate.of(new PipelineSteps.Describe());
        describe.after(load);

        PipelineInvocationGraph graph = PipelineBuild.build("after", null, build -> {
            describe.call(build, Map.of());
            load.call(build, Map.of());
        });

        assertEquals(Set.of("load"), graph.getNode("Describe").upstream());
        assertEquals(List.of("load", "Describe"), graph.getInvocationIds());
    }

    @Test
    void orderingHint_templateCalledTwiceIsAmbiguous() {
        StepTemplate describe = StepTemplate.of(new PipelineSteps.Describe());
        describe.after(load);

        try (PipelineBuild build = PipelineBuild.begin("ambiguous", null)) {
            load.call(build, Map.of());
            describe.call(build, Map.of());
            describe.call(build, Map.of());

            AmbiguousOrderingException e = assertThrows(AmbiguousOrderingException.class, build::finalizeGraph);
            assertEquals("Describe", e.getStepName());
        }
    }

    @Test
    void orderingHint_upstreamTemplateCalledTwiceIsAmbiguous() {
        StepTemplate describe = StepTemplate.of(new PipelineSteps.Describe());
        describe.after(load);

        try (PipelineBuild build = PipelineBuild.begin("ambiguous", null)) {
            load.call(build, Map.of());
            load.call(build, Map.of());
            describe.call(build, Map.of());

            AmbiguousOrderingException e = assertThrows(AmbiguousOrderingException.class, build::finalizeGraph);
            assertEquals("load", e.getStepName());
        }
    }

    @Test
    void orderingHint_unusedUpstreamTemplateIsIgnored() {
        StepTemplate describe = StepTemplate.of(new PipelineSteps.Describe());
        describe.after(load);

        PipelineInvocationGraph graph = PipelineBuild.build("unused", null, build -> describe.call(build, Map.of()));

        assertTrue(graph.getNode("Describe").upstream().isEmpty());
    }

    @Test
    void begin_secondBuildWhileActiveFails() {
        try (PipelineBuild build = PipelineBuild.begin("outer", null)) {
            assertSame(build, PipelineBuild.active().orElseThrow());
            assertThrows(IllegalStateException.class, () -> PipelineBuild.begin("inner", null));
        }
        assertFalse(PipelineBuild.active().isPresent());

        try (PipelineBuild again = PipelineBuild.begin("again", null)) {
            assertSame(again, PipelineBuild.active().orElseThrow());
        }
    }

    @Test
    void build_releasesActiveBuildOnFailure() {
        assertThrows(MissingInputException.class,
                () -> PipelineBuild.build("failing", null, build -> train.call(build, Map.of("epochs", 1))));

        assertFalse(PipelineBuild.active().isPresent());
    }

    @Test
    void close_rejectsFurtherInvocations() {
        PipelineBuild build = PipelineBuild.begin("closed", null);
        build.close();

        assertThrows(IllegalStateException.class, () -> load.call(build, Map.of()));
    }

    @Test
    void externalArtifact_valueUploadedOnceAcrossFinalizations() {
        ExternalArtifact data = ExternalArtifact.ofValue(List.of(4, 5));
        try (PipelineBuild build = PipelineBuild.begin("external", uploadContext)) {
            train.call(build, Map.of("data", data, "epochs", 2));

            PipelineInvocationGraph graph = build.finalizeGraph();
            UUID id = graph.getNode("train").externalArtifacts().get("data");
            StepConfiguration again = build.finalizeInvocation("train");

            assertNotNull(id);
            assertEquals(Map.of("data", id), again.getExternalInputArtifacts());
            assertEquals(1, metadataStore.getAll().size());
            assertTrue(graph.getNode("train").upstream().isEmpty());
        }
    }

    @Test
    void externalArtifact_referenceFromOtherStoreFails() {
        UUID artifactId = UUID.randomUUID();
        metadataStore.put(new ArtifactRecord(artifactId, "data", "DATA", "/elsewhere/data",
                Source.fromClass(JsonContainerMaterializer.class), Source.fromClass(List.class), UUID.randomUUID()));

        try (PipelineBuild build = PipelineBuild.begin("mismatch", uploadContext)) {
            train.call(build, Map.of("data", ExternalArtifact.ofId(artifactId), "epochs", 1));

            ArtifactStoreMismatchException e = assertThrows(ArtifactStoreMismatchException.class, build::finalizeGraph);
            assertEquals(artifactId, e.getArtifactId());
            assertEquals(storeId, e.getExpectedArtifactStoreId());
        }
    }

    @Test
    void externalArtifact_referenceInSameStoreIsUsed() {
        UUID artifactId = UUID.randomUUID();
        metadataStore.put(new ArtifactRecord(artifactId, "data", "DATA", tempDir.resolve("data").toString(),
                Source.fromClass(JsonContainerMaterializer.class), Source.fromClass(List.class), storeId));

        PipelineInvocationGraph graph = PipelineBuild.build("reference", uploadContext,
                build -> train.call(build, Map.of("data", ExternalArtifact.ofId(artifactId), "epochs", 1)));

        assertEquals(Map.of("data", artifactId), graph.getNode("train").externalArtifacts());
    }

    @Test
    void externalArtifact_typeMismatchRejectedAtCall() {
        try (PipelineBuild build = PipelineBuild.begin("external-type", uploadContext)) {
            assertThrows(StepInterfaceException.class,
                    () -> train.call(build, Map.of("data", ExternalArtifact.ofValue("text"), "epochs", 1)));
        }
    }
}
