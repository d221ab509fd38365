package com.argument.mapping.argweave.service.graph;

import com.argument.mapping.argweave.model.PipelineConfig;
import com.argument.mapping.argweave.model.argument.ArgumentEdge;
import com.argument.mapping.argweave.model.argument.ArgumentGraph;
import com.argument.mapping.argweave.model.argument.ArgumentNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Merges near-duplicate nodes.
 *
 * Nodes are visited by confidence descending, then id ascending, so the first
 * survivor a node matches always has strictly higher confidence or the same
 * confidence and a smaller id. Edges of a merged node are rewritten to its
 * survivor and the resulting duplicates collapsed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NodeDeduplicator {

    private static final Comparator<ArgumentNode> SURVIVOR_ORDER = Comparator
            .comparingDouble(ArgumentNode::getConfidence).reversed()
            .thenComparing(ArgumentNode::getId);

    private final TextSimilarity textSimilarity;

    public DeduplicationResult deduplicate(ArgumentGraph graph, PipelineConfig config) {
        if (graph.nodeCount() < 2) {
            return DeduplicationResult.builder()
                    .graph(graph)
                    .mergedIds(Collections.emptyMap())
                    .build();
        }

        List<ArgumentNode> ranked = new ArrayList<>(graph.getNodes());
        ranked.sort(SURVIVOR_ORDER);

        List<ArgumentNode> survivors = new ArrayList<>();
        Map<String, String> mergedIds = new LinkedHashMap<>();

        for (ArgumentNode node : ranked) {
            Optional<ArgumentNode> match = survivors.stream()
                    .filter(survivor -> isDuplicate(survivor, node, config.getDedupThreshold()))
                    .findFirst();
            if (match.isPresent()) {
                mergedIds.put(node.getId(), match.get().getId());
                log.debug("Merging node {} into {}", node.getId(), match.get().getId());
            } else {
                survivors.add(node);
            }
        }

        if (mergedIds.isEmpty()) {
            return DeduplicationResult.builder()
                    .graph(graph)
                    .mergedIds(Collections.emptyMap())
                    .build();
        }

        List<ArgumentEdge> rewritten = new ArrayList<>();
        int selfLoops = 0;
        for (ArgumentEdge edge : graph.getEdges()) {
            String source = mergedIds.getOrDefault(edge.getSource(), edge.getSource());
            String target = mergedIds.getOrDefault(edge.getTarget(), edge.getTarget());
            if (source.equals(target)) {
                selfLoops++;
                continue;
            }
            rewritten.add(edge.retarget(source, target));
        }
        List<ArgumentEdge> collapsed = GraphEdges.collapseByPair(rewritten);

        ArgumentGraph result = graph.withoutNodes(mergedIds.keySet()).withEdges(collapsed);
        log.info("Deduplication merged {} nodes ({} -> {}), edges {} -> {}",
                mergedIds.size(), graph.nodeCount(), result.nodeCount(), graph.edgeCount(), result.edgeCount());

        return DeduplicationResult.builder()
                .graph(result)
                .mergedIds(Collections.unmodifiableMap(mergedIds))
                .selfLoopsDropped(selfLoops)
                .edgesCollapsed(rewritten.size() - collapsed.size())
                .build();
    }

    /**
     * Fails closed: any error while comparing two texts means "not a duplicate".
     */
    private boolean isDuplicate(ArgumentNode survivor, ArgumentNode candidate, double threshold) {
        try {
            double similarity = textSimilarity.tokenSortRatio(survivor.comparableText(), candidate.comparableText());
            return similarity >= threshold;
        } catch (RuntimeException e) {
            log.warn("Similarity check failed for {} / {}, treating as distinct: {}",
                    survivor.getId(), candidate.getId(), e.getMessage());
            return false;
        }
    }
}
