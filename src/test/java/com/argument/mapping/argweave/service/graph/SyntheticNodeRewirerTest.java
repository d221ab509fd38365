package com.argument.mapping.argweave.service.graph;

import com.argument.mapping.argweave.exception.SynthesisException;
import com.argument.mapping.argweave.model.PipelineConfig;
import com.argument.mapping.argweave.model.argument.ArgumentEdge;
import com.argument.mapping.argweave.model.argument.ArgumentGraph;
import com.argument.mapping.argweave.model.argument.ArgumentNode;
import com.argument.mapping.argweave.model.argument.NodeRole;
import com.argument.mapping.argweave.service.llm.ClaimSynthesizer;
import com.argument.mapping.argweave.service.llm.SynthesizedClaim;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.argument.mapping.argweave.model.argument.ArgumentGraphFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SyntheticNodeRewirerTest {

    private static final String SYNTHETIC_ID = "syn_claim_d1ec8ff8";    // md5("P1:P2:P3")

    @Mock
    private ClaimSynthesizer synthesizer;

    private final TextSimilarity textSimilarity = new TextSimilarity();
    private final SyntheticNodeRewirer rewirer =
            new SyntheticNodeRewirer(new PremiseClusterer(textSimilarity), new HallucinationGuard());

    private final PipelineConfig enabled = PipelineConfig.builder().syntheticEnabled(true).build();

    private final ArgumentGraph graph = ArgumentGraph.of(
            List.of(
                    claim("C1", "Cities should subsidize solar panels"),
                    premise("P1", "Solar panels lower household energy bills", 1),
                    premise("P2", "Solar panels lower business energy bills", 2),
                    premise("P3", "Solar panels lower school energy bills", 3)),
            List.of(support("P1", "C1", 0.8), support("P2", "C1", 0.7), support("P3", "C1", 0.6)));

    @Test
    void insertsSyntheticClaim_andRewiresPremisesThroughIt() {
        when(synthesizer.synthesize(any())).thenReturn(reply("Solar panels lower energy bills", true, 0.85));

        RewireResult result = rewirer.rewire(graph, enabled, synthesizer);

        assertThat(result.getSyntheticNodeIds()).containsExactly(SYNTHETIC_ID);
        assertThat(result.getClustersFound()).isEqualTo(1);
        assertThat(result.getSkipReasons()).isEmpty();

        ArgumentGraph rewired = result.getGraph();
        ArgumentNode synthetic = rewired.getNode(SYNTHETIC_ID);
        assertThat(synthetic.getRole()).isEqualTo(NodeRole.CLAIM);
        assertThat(synthetic.isSynthetic()).isTrue();
        assertThat(synthetic.getSourcePremiseIds()).containsExactly("P1", "P2", "P3");
        assertThat(synthetic.getSynthesisMethod()).isEqualTo("llm");
        assertThat(synthetic.getSpan()).isEqualTo("Solar panels lower energy bills");

        assertThat(rewired.getEdges()).hasSize(4);
        assertThat(rewired.getEdges().subList(0, 3)).containsExactly(
                support("P1", SYNTHETIC_ID, 0.8),
                support("P2", SYNTHETIC_ID, 0.7),
                support("P3", SYNTHETIC_ID, 0.6));
        ArgumentEdge bridge = rewired.getEdges().get(3);
        assertThat(bridge.getSource()).isEqualTo(SYNTHETIC_ID);
        assertThat(bridge.getTarget()).isEqualTo("C1");
        assertThat(bridge.isSupport()).isTrue();
        assertThat(bridge.getConfidence()).isCloseTo(0.8 * 0.95, within(1e-9));

        // Input graph is never modified
        assertThat(graph.nodeCount()).isEqualTo(4);
        assertThat(graph.incoming("C1")).hasSize(3);
    }

    @Test
    void disabled_leavesGraphUnchanged_withoutCallingSynthesizer() {
        RewireResult result = rewirer.rewire(graph, PipelineConfig.defaults(), synthesizer);

        assertThat(result.isEnabled()).isFalse();
        assertThat(result.getGraph()).isSameAs(graph);
        verifyNoInteractions(synthesizer);
    }

    @Test
    void timeout_skipsCluster() {
        when(synthesizer.synthesize(any())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return reply("Solar panels lower energy bills", true, 0.9);
        });
        PipelineConfig config = enabled.toBuilder().synthesisTimeout(Duration.ofMillis(100)).build();

        RewireResult result = rewirer.rewire(graph, config, synthesizer);

        assertThat(result.getSkipReasons()).containsEntry("timeout", 1);
        assertThat(result.getGraph()).isEqualTo(graph);
    }

    @Test
    void callIgnoringInterruption_doesNotStarveLaterClusters() {
        ArgumentGraph twoTargets = ArgumentGraph.of(
                List.of(
                        claim("C1", "Cities should subsidize solar panels"),
                        claim("C2", "Counties should subsidize solar panels"),
                        premise("P1", "Solar panels lower household energy bills", 1),
                        premise("P2", "Solar panels lower business energy bills", 2),
                        premise("P3", "Solar panels lower school energy bills", 3),
                        premise("P4", "Solar panels lower farm energy bills", 4),
                        premise("P5", "Solar panels lower church energy bills", 5),
                        premise("P6", "Solar panels lower hospital energy bills", 6)),
                List.of(support("P1", "C1", 0.8), support("P2", "C1", 0.7), support("P3", "C1", 0.6),
                        support("P4", "C2", 0.8), support("P5", "C2", 0.7), support("P6", "C2", 0.6)));
        AtomicInteger calls = new AtomicInteger();
        when(synthesizer.synthesize(any())).thenAnswer(invocation -> {
            calls.incrementAndGet();
            PremiseCluster cluster = invocation.getArgument(0);
            if (cluster.getTargetId().equals("C1")) {
                long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(1_500);
                while (System.nanoTime() < until) {
                    Thread.onSpinWait();
                }
            }
            return reply("Solar panels lower energy bills", true, 0.9);
        });
        PipelineConfig config = enabled.toBuilder().synthesisTimeout(Duration.ofMillis(300)).build();

        RewireResult result = rewirer.rewire(twoTargets, config, synthesizer);

        assertThat(result.getClustersFound()).isEqualTo(2);
        assertThat(result.getSkipReasons()).containsExactly(entry("timeout", 1));
        assertThat(result.getSyntheticNodeIds())
                .containsExactly(SyntheticNodeRewirer.syntheticNodeId(List.of("P4", "P5", "P6")));
        assertThat(calls.get()).isEqualTo(2);
        assertThat(result.getGraph().incoming("C1")).hasSize(3);
    }

    @Test
    void synthesizerError_skipsCluster() {
        when(synthesizer.synthesize(any())).thenThrow(new SynthesisException("Unparseable model reply"));

        RewireResult result = rewirer.rewire(graph, enabled, synthesizer);

        assertThat(result.getSkipReasons()).containsEntry("synthesis_error", 1);
        assertThat(result.getGraph()).isEqualTo(graph);
    }

    @Test
    void hallucinatedNumber_isRejected() {
        when(synthesizer.synthesize(any())).thenReturn(reply("Solar panels cut energy bills by 40 percent", true, 0.9));

        RewireResult result = rewirer.rewire(graph, enabled, synthesizer);

        assertThat(result.getSkipReasons()).containsEntry("hallucination", 1);
        assertThat(result.getSyntheticNodeIds()).isEmpty();
        assertThat(result.getGraph()).isEqualTo(graph);
    }

    @Test
    void incoherentOrLowConfidenceReplies_areRejected() {
        when(synthesizer.synthesize(any())).thenReturn(reply("Solar panels lower energy bills", false, 0.9));
        assertThat(rewirer.rewire(graph, enabled, synthesizer).getSkipReasons()).containsEntry("incoherent", 1);

        when(synthesizer.synthesize(any())).thenReturn(reply("Solar panels lower energy bills", true, 0.2));
        assertThat(rewirer.rewire(graph, enabled, synthesizer).getSkipReasons()).containsEntry("low_confidence", 1);
    }

    @Test
    void overlongReply_isRejected() {
        String longText = String.join(" ", java.util.Collections.nCopies(21, "solar"));
        when(synthesizer.synthesize(any())).thenReturn(reply(longText, true, 0.9));

        assertThat(rewirer.rewire(graph, enabled, synthesizer).getSkipReasons()).containsEntry("too_long", 1);
    }

    @Test
    void lowCoherenceCluster_isSkippedWithoutCallingSynthesizer() {
        PipelineConfig strict = enabled.toBuilder().minCoherence(0.95).build();

        RewireResult result = rewirer.rewire(graph, strict, synthesizer);

        assertThat(result.getSkipReasons()).containsEntry("low_coherence", 1);
        verifyNoInteractions(synthesizer);
    }

    @Test
    void syntheticNodeId_dependsOnlyOnPremiseSet() {
        assertThat(SyntheticNodeRewirer.syntheticNodeId(List.of("P3", "P1", "P2"))).isEqualTo(SYNTHETIC_ID);
        assertThat(SyntheticNodeRewirer.syntheticNodeId(List.of("P1", "P2"))).isNotEqualTo(SYNTHETIC_ID);
    }

    private static SynthesizedClaim reply(String text, boolean coherent, double confidence) {
        return SynthesizedClaim.builder()
                .text(text)
                .coherent(coherent)
                .confidence(confidence)
                .build();
    }
}
