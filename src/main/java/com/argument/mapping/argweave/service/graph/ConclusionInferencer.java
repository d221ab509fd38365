package com.argument.mapping.argweave.service.graph;

import com.argument.mapping.argweave.dto.graph.ConclusionScore;
import com.argument.mapping.argweave.model.PipelineConfig;
import com.argument.mapping.argweave.model.argument.ArgumentEdge;
import com.argument.mapping.argweave.model.argument.ArgumentGraph;
import com.argument.mapping.argweave.model.argument.ArgumentNode;
import com.argument.mapping.argweave.model.argument.NodeRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Promotes claims to conclusions from graph topology alone.
 *
 * Score = w_in * incoming support + w_distinct * distinct supporting sources
 *       + w_sink (only when the claim supports nothing further).
 * A claim without incoming support is never eligible. After relabeling, edges
 * from a conclusion into a non-conclusion are removed, and any non-claim node
 * left without edges by that removal is dropped.
 */
@Service
@Slf4j
public class ConclusionInferencer {

    private static final Comparator<ConclusionScore> BEST_FIRST = Comparator
            .comparingDouble(ConclusionScore::getScore).reversed()
            .thenComparing(ConclusionScore::getNodeId);

    public ConclusionInferenceResult infer(ArgumentGraph graph, PipelineConfig config) {
        List<ConclusionScore> scores = graph.getNodes().stream()
                .filter(n -> n.getRole() == NodeRole.CLAIM)
                .map(n -> score(n, graph, config))
                .sorted(BEST_FIRST)
                .collect(Collectors.toList());

        List<ConclusionScore> eligible = scores.stream()
                .filter(ConclusionScore::isEligible)
                .collect(Collectors.toList());
        int limit = config.getMaxConclusions() == 0 ? eligible.size() : Math.min(config.getMaxConclusions(), eligible.size());
        List<String> selectedIds = eligible.subList(0, limit).stream()
                .map(ConclusionScore::getNodeId)
                .collect(Collectors.toList());
        scores.forEach(s -> s.setSelected(selectedIds.contains(s.getNodeId())));

        for (ConclusionScore s : scores.subList(0, Math.min(5, scores.size()))) {
            log.debug("Conclusion candidate {}: {}", s.getNodeId(), s.getReasoning());
        }

        if (selectedIds.isEmpty()) {
            log.info("No claim qualified as conclusion ({} claims scored)", scores.size());
            return ConclusionInferenceResult.builder()
                    .graph(graph)
                    .scores(scores)
                    .selectedIds(Collections.emptyList())
                    .orphanedIds(Collections.emptyList())
                    .build();
        }

        List<ArgumentNode> promoted = selectedIds.stream()
                .map(id -> graph.getNode(id).promoteToConclusion())
                .collect(Collectors.toList());
        ArgumentGraph relabeled = graph.replaceNodes(promoted);

        Set<String> conclusionIds = relabeled.getNodes().stream()
                .filter(n -> n.getRole() == NodeRole.CONCLUSION)
                .map(ArgumentNode::getId)
                .collect(Collectors.toSet());
        ArgumentGraph constrained = relabeled.filterEdges(
                e -> !conclusionIds.contains(e.getSource()) || conclusionIds.contains(e.getTarget()));
        int removed = relabeled.edgeCount() - constrained.edgeCount();

        // nodes reached only through a dropped conclusion edge
        Set<String> stillConnected = new HashSet<>();
        for (ArgumentEdge edge : constrained.getEdges()) {
            stillConnected.add(edge.getSource());
            stillConnected.add(edge.getTarget());
        }
        List<String> orphaned = constrained.getNodes().stream()
                .filter(n -> !n.getRole().isRootCandidate())
                .filter(n -> !stillConnected.contains(n.getId()))
                .filter(n -> !relabeled.incoming(n.getId()).isEmpty() || !relabeled.outgoing(n.getId()).isEmpty())
                .map(ArgumentNode::getId)
                .collect(Collectors.toList());
        if (!orphaned.isEmpty()) {
            log.info("Removing {} node(s) isolated by conclusion edge removal: {}", orphaned.size(), orphaned);
            constrained = constrained.withoutNodes(new LinkedHashSet<>(orphaned));
        }

        for (String id : selectedIds) {
            boolean supported = constrained.incoming(id).stream().anyMatch(ArgumentEdge::isSupport);
            if (!supported) {
                log.warn("Conclusion {} has no incoming support edge", id);
            }
        }

        log.info("Promoted {} claim(s) to conclusion: {}; removed {} outgoing conclusion edges",
                selectedIds.size(), selectedIds, removed);

        return ConclusionInferenceResult.builder()
                .graph(constrained)
                .scores(scores)
                .selectedIds(Collections.unmodifiableList(selectedIds))
                .edgesRemoved(removed)
                .orphanedIds(Collections.unmodifiableList(orphaned))
                .build();
    }

    private ConclusionScore score(ArgumentNode node, ArgumentGraph graph, PipelineConfig config) {
        List<ArgumentEdge> incomingSupport = graph.incoming(node.getId()).stream()
                .filter(ArgumentEdge::isSupport)
                .collect(Collectors.toList());
        int distinctSources = (int) incomingSupport.stream().map(ArgumentEdge::getSource).distinct().count();
        int outgoingSupport = (int) graph.outgoing(node.getId()).stream().filter(ArgumentEdge::isSupport).count();
        double sinkBonus = outgoingSupport == 0 ? config.getSinkBonusWeight() : 0.0;

        double score = config.getIncomingSupportWeight() * incomingSupport.size()
                + config.getDistinctSourceWeight() * distinctSources
                + sinkBonus;
        boolean eligible = !incomingSupport.isEmpty() && score >= config.getConclusionScoreThreshold();

        String reasoning = String.format(Locale.ROOT,
                "Score: %.2f | Support: %d from %d sources | Outgoing support: %d | Sink bonus: %.2f%s",
                score, incomingSupport.size(), distinctSources, outgoingSupport, sinkBonus,
                incomingSupport.isEmpty() ? " | ineligible: no incoming support" : "");

        return ConclusionScore.builder()
                .nodeId(node.getId())
                .incomingSupportCount(incomingSupport.size())
                .distinctSources(distinctSources)
                .outgoingSupportCount(outgoingSupport)
                .sinkBonus(sinkBonus)
                .score(score)
                .eligible(eligible)
                .reasoning(reasoning)
                .build();
    }
}
