package com.codeforge.orchestrator.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Node lookup by name, populated once at startup. */
public class NodeRegistry {

    private static final Logger log = LoggerFactory.getLogger(NodeRegistry.class);

    private final Map<String, WorkflowNode> nodes = new ConcurrentHashMap<>();

    public NodeRegistry(List<? extends WorkflowNode> allNodes) {
        for (WorkflowNode node : allNodes) {
            WorkflowNode previous = nodes.putIfAbsent(node.name(), node);
            if (previous != null) {
                throw new IllegalStateException("Duplicate workflow node '" + node.name() + "'");
            }
            log.info("Registered workflow node '{}' (progress {})", node.name(), node.progress());
        }
    }

    public WorkflowNode get(String name) {
        WorkflowNode node = nodes.get(name);
        if (node == null) {
            throw new WorkflowGraphException("Unknown workflow node '" + name + "'");
        }
        return node;
    }
}
