package com.argument.mapping.argweave.service.graph;

import com.argument.mapping.argweave.model.PipelineConfig;
import com.argument.mapping.argweave.model.argument.ArgumentEdge;
import com.argument.mapping.argweave.model.argument.ArgumentGraph;
import com.argument.mapping.argweave.model.argument.ArgumentNode;
import com.argument.mapping.argweave.model.argument.EdgeRelation;
import com.argument.mapping.argweave.model.argument.NodeRole;
import com.argument.mapping.argweave.service.llm.ClaimSynthesizer;
import com.argument.mapping.argweave.service.llm.SynthesizedClaim;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Inserts synthesized intermediate claims between premise clusters and the claim
 * they support, turning premise -> parent into premise -> synthetic -> parent.
 *
 * Each cluster is handled on its own: a timeout, a model error or a rejected reply
 * skips that cluster and leaves its edges untouched.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SyntheticNodeRewirer {

    static final String SYNTHESIS_METHOD = "llm";

    private final AtomicInteger threadSequence = new AtomicInteger();

    private final PremiseClusterer premiseClusterer;
    private final HallucinationGuard hallucinationGuard;

    public RewireResult rewire(ArgumentGraph graph, PipelineConfig config, ClaimSynthesizer synthesizer) {
        if (!config.isSyntheticEnabled() || synthesizer == null) {
            if (config.isSyntheticEnabled()) {
                log.warn("Synthetic rewiring enabled but no claim synthesizer is configured");
            }
            return RewireResult.builder()
                    .graph(graph)
                    .enabled(false)
                    .syntheticNodeIds(Collections.emptyList())
                    .skipReasons(Collections.emptyMap())
                    .build();
        }

        List<PremiseCluster> clusters = premiseClusterer.findClusters(graph, config);
        Map<String, Integer> skipReasons = new TreeMap<>();
        List<String> syntheticIds = new ArrayList<>();
        ArgumentGraph current = graph;

        // a call that ignores interruption keeps its own thread, never the next cluster's
        ExecutorService executor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "claim-synthesis-" + threadSequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        try {
            for (PremiseCluster cluster : clusters) {
                if (cluster.getCoherence() < config.getMinCoherence()) {
                    skip(skipReasons, cluster, "low_coherence");
                    continue;
                }

                SynthesizedClaim claim;
                try {
                    claim = callWithTimeout(executor, synthesizer, cluster, config);
                } catch (TimeoutException e) {
                    skip(skipReasons, cluster, "timeout");
                    continue;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("Synthesis failed for {}: {}", cluster.getClusterId(), cause.getMessage());
                    skip(skipReasons, cluster, "synthesis_error");
                    continue;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    skip(skipReasons, cluster, "interrupted");
                    break;
                }

                Optional<String> rejection = rejectionReason(claim, cluster, config);
                if (rejection.isPresent()) {
                    skip(skipReasons, cluster, rejection.get());
                    continue;
                }

                String syntheticId = syntheticNodeId(cluster.getPremiseIds());
                if (current.containsNode(syntheticId)) {
                    skip(skipReasons, cluster, "id_collision");
                    continue;
                }

                current = insertSyntheticNode(current, cluster, claim, syntheticId, config);
                syntheticIds.add(syntheticId);
                log.info("Inserted synthetic claim {} between {} premises and {}",
                        syntheticId, cluster.size(), cluster.getTargetId());
            }
        } finally {
            executor.shutdownNow();
        }

        log.info("Synthetic rewiring: {} clusters, {} synthesized, skipped {}",
                clusters.size(), syntheticIds.size(), skipReasons);

        return RewireResult.builder()
                .graph(current)
                .enabled(true)
                .clustersFound(clusters.size())
                .syntheticNodeIds(Collections.unmodifiableList(syntheticIds))
                .skipReasons(Collections.unmodifiableMap(skipReasons))
                .build();
    }

    private SynthesizedClaim callWithTimeout(ExecutorService executor, ClaimSynthesizer synthesizer,
                                             PremiseCluster cluster, PipelineConfig config)
            throws TimeoutException, ExecutionException, InterruptedException {
        Future<SynthesizedClaim> future = executor.submit(() -> synthesizer.synthesize(cluster));
        try {
            return future.get(config.getSynthesisTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private Optional<String> rejectionReason(SynthesizedClaim claim, PremiseCluster cluster, PipelineConfig config) {
        if (claim == null || claim.getText() == null || claim.getText().isBlank()) {
            return Optional.of("empty_reply");
        }
        if (!claim.isCoherent()) {
            return Optional.of("incoherent");
        }
        if (claim.getConfidence() < config.getMinSynthesisConfidence()) {
            return Optional.of("low_confidence");
        }
        if (claim.getText().trim().split("\\s+").length > config.getMaxSyntheticClaimWords()) {
            return Optional.of("too_long");
        }
        Optional<String> ungrounded = hallucinationGuard.findUngroundedContent(claim.getText(), cluster.getPremiseTexts());
        if (ungrounded.isPresent()) {
            log.warn("Rejected synthetic claim for {}: {}", cluster.getClusterId(), ungrounded.get());
            return Optional.of("hallucination");
        }
        return Optional.empty();
    }

    private ArgumentGraph insertSyntheticNode(ArgumentGraph graph, PremiseCluster cluster, SynthesizedClaim claim,
                                              String syntheticId, PipelineConfig config) {
        Set<String> premiseIds = new HashSet<>(cluster.getPremiseIds());
        String parentId = cluster.getTargetId();

        List<ArgumentEdge> edges = new ArrayList<>();
        double strongest = 0.0;
        for (ArgumentEdge edge : graph.getEdges()) {
            if (edge.isSupport() && premiseIds.contains(edge.getSource()) && edge.getTarget().equals(parentId)) {
                edges.add(edge.retarget(edge.getSource(), syntheticId));
                strongest = Math.max(strongest, edge.getConfidence());
            } else {
                edges.add(edge);
            }
        }
        edges.add(ArgumentEdge.builder()
                .source(syntheticId)
                .target(parentId)
                .relation(EdgeRelation.SUPPORT)
                .confidence(strongest * config.getSyntheticEdgePenalty())
                .build());

        String text = claim.getText().trim();
        ArgumentNode synthetic = ArgumentNode.builder()
                .id(syntheticId)
                .role(NodeRole.CLAIM)
                .label(claim.getLabel() != null && !claim.getLabel().isBlank() ? claim.getLabel() : abbreviate(text, 80))
                .span(text)
                .confidence(Math.max(0.0, Math.min(1.0, claim.getConfidence())))
                .ordinal(graph.nodeCount())
                .synthetic(true)
                .sourcePremiseIds(cluster.getPremiseIds())
                .synthesisMethod(SYNTHESIS_METHOD)
                .build();

        return graph.extend(List.of(synthetic), edges);
    }

    /**
     * Stable id derived from the sorted premise ids.
     */
    static String syntheticNodeId(List<String> premiseIds) {
        List<String> sorted = new ArrayList<>(premiseIds);
        Collections.sort(sorted);
        String digest = DigestUtils.md5DigestAsHex(String.join(":", sorted).getBytes(StandardCharsets.UTF_8));
        return "syn_claim_" + digest.substring(0, 8);
    }

    private void skip(Map<String, Integer> skipReasons, PremiseCluster cluster, String reason) {
        log.warn("Skipping cluster {} (target {}): {}", cluster.getClusterId(), cluster.getTargetId(), reason);
        skipReasons.merge(reason, 1, Integer::sum);
    }

    private String abbreviate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max - 3) + "...";
    }
}
