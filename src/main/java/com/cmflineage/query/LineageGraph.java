package com.cmflineage.query;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.cmflineage.model.EventDirection;

public record LineageGraph(List<Node> nodes, List<Edge> edges) {
    public LineageGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public Optional<Node> node(String id) {
        return nodes.stream().filter(node -> node.id().equals(id)).findFirst();
    }

    public List<Node> nodesOfType(NodeType type) {
        return nodes.stream().filter(node -> node.type() == type).toList();
    }

    public enum NodeType {
        EXECUTION,
        ARTIFACT
    }

    public record Node(String id, NodeType type, String label, Map<String, Object> attributes) {
        public Node {
            attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        }
    }

    public record Edge(String source, String target, EventDirection direction) {
    }
}
