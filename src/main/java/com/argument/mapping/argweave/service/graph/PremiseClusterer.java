package com.argument.mapping.argweave.service.graph;

import com.argument.mapping.argweave.model.PipelineConfig;
import com.argument.mapping.argweave.model.argument.ArgumentEdge;
import com.argument.mapping.argweave.model.argument.ArgumentGraph;
import com.argument.mapping.argweave.model.argument.ArgumentNode;
import com.argument.mapping.argweave.model.argument.NodeRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Heuristic premise clustering: shared support target, input proximity and
 * lexical similarity. No learned model involved.
 *
 * A premise supporting several targets is grouped under its smallest target id
 * only, so clusters never share a premise.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PremiseClusterer {

    private final TextSimilarity textSimilarity;

    public List<PremiseCluster> findClusters(ArgumentGraph graph, PipelineConfig config) {
        Map<String, List<ArgumentNode>> byTarget = groupPremisesByTarget(graph);
        List<PremiseCluster> clusters = new ArrayList<>();

        for (Map.Entry<String, List<ArgumentNode>> entry : byTarget.entrySet()) {
            String targetId = entry.getKey();
            List<ArgumentNode> premises = entry.getValue();
            if (premises.size() < config.getMinClusterSize()) {
                continue;
            }
            String targetText = graph.findNode(targetId).map(ArgumentNode::comparableText).orElse(null);

            Set<String> clustered = new HashSet<>();
            for (List<ArgumentNode> group : clusterByProximityAndSimilarity(premises, config)) {
                if (group.size() < config.getMinClusterSize() || group.size() > config.getMaxClusterSize()) {
                    continue;
                }
                clusters.add(toCluster("cluster_" + clusters.size(), targetId, targetText, group, coherence(group), false));
                group.forEach(p -> clustered.add(p.getId()));
            }

            List<ArgumentNode> leftover = premises.stream()
                    .filter(p -> !clustered.contains(p.getId()))
                    .collect(Collectors.toList());
            if (leftover.size() >= config.getFanInThreshold() && leftover.size() <= config.getMaxClusterSize()) {
                clusters.add(toCluster("fan_in_" + targetId, targetId, targetText, leftover, 1.0, true));
            }
        }

        log.info("Found {} premise clusters across {} support targets", clusters.size(), byTarget.size());
        return clusters;
    }

    private Map<String, List<ArgumentNode>> groupPremisesByTarget(ArgumentGraph graph) {
        Map<String, String> primaryTarget = new HashMap<>();
        for (ArgumentEdge edge : graph.supportEdges()) {
            primaryTarget.merge(edge.getSource(), edge.getTarget(), (a, b) -> a.compareTo(b) <= 0 ? a : b);
        }

        Map<String, List<ArgumentNode>> byTarget = new TreeMap<>();
        for (ArgumentNode node : graph.getNodes()) {
            if (node.getRole() != NodeRole.PREMISE || node.isSynthetic()) continue;
            String target = primaryTarget.get(node.getId());
            if (target == null) continue;
            byTarget.computeIfAbsent(target, k -> new ArrayList<>()).add(node);
        }
        byTarget.values().forEach(list -> list.sort(Comparator.comparingInt(ArgumentNode::getOrdinal)));
        return byTarget;
    }

    /**
     * Greedy seeding: the first remaining premise absorbs every later premise that
     * is within the position window and similar enough to it.
     */
    private List<List<ArgumentNode>> clusterByProximityAndSimilarity(List<ArgumentNode> premises, PipelineConfig config) {
        List<List<ArgumentNode>> groups = new ArrayList<>();
        LinkedList<ArgumentNode> remaining = new LinkedList<>(premises);

        while (!remaining.isEmpty()) {
            ArgumentNode seed = remaining.removeFirst();
            List<ArgumentNode> group = new ArrayList<>();
            group.add(seed);

            Iterator<ArgumentNode> it = remaining.iterator();
            while (it.hasNext()) {
                ArgumentNode candidate = it.next();
                if (Math.abs(candidate.getOrdinal() - seed.getOrdinal()) > config.getMaxPositionDistance()) {
                    continue;
                }
                double similarity = textSimilarity.tokenSortRatio(seed.comparableText(), candidate.comparableText());
                if (similarity < config.getClusterSimilarityThreshold()) {
                    continue;
                }
                group.add(candidate);
                it.remove();
            }
            groups.add(group);
        }
        return groups;
    }

    private double coherence(List<ArgumentNode> group) {
        if (group.size() < 2) return 1.0;
        double total = 0.0;
        int pairs = 0;
        for (int i = 0; i < group.size(); i++) {
            for (int j = i + 1; j < group.size(); j++) {
                total += textSimilarity.tokenSortRatio(group.get(i).comparableText(), group.get(j).comparableText());
                pairs++;
            }
        }
        return total / pairs;
    }

    private PremiseCluster toCluster(String clusterId, String targetId, String targetText,
                                     List<ArgumentNode> group, double coherence, boolean fanIn) {
        return PremiseCluster.builder()
                .clusterId(clusterId)
                .targetId(targetId)
                .targetText(targetText)
                .premiseIds(group.stream().map(ArgumentNode::getId).collect(Collectors.toList()))
                .premiseTexts(group.stream().map(ArgumentNode::comparableText).collect(Collectors.toList()))
                .coherence(coherence)
                .fanIn(fanIn)
                .build();
    }
}
