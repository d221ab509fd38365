package com.argument.mapping.argweave.service.layout;

import com.argument.mapping.argweave.model.PipelineConfig;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Turns (layer, order) into coordinates. y depends on the layer only; x spaces the
 * nodes of a layer evenly around 0.
 */
@Component
public class PositionAssigner {

    public Map<String, LayoutPosition> assign(SortedMap<Integer, List<String>> nodesByLayer,
                                              Map<String, Integer> orders,
                                              PipelineConfig config) {
        Map<String, LayoutPosition> positions = new LinkedHashMap<>();
        for (Map.Entry<Integer, List<String>> entry : nodesByLayer.entrySet()) {
            int layer = entry.getKey();
            List<String> nodes = entry.getValue();
            double center = (nodes.size() - 1) / 2.0;
            for (String id : nodes) {
                double x = (orders.get(id) - center) * config.getSiblingSpacing();
                double y = layer * config.getLayerSpacing();
                positions.put(id, new LayoutPosition(x, y));
            }
        }
        return positions;
    }
}
