package com.stepflow.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable result of a pipeline build. Nodes are in topological order: every node comes after
 * all of its upstream nodes. Safe to share between threads.
 */
public final class PipelineInvocationGraph {

    private final String pipelineName;
    private final List<InvocationNode> nodes;
    private final Map<String, InvocationNode> byId;

    PipelineInvocationGraph(String pipelineName, List<InvocationNode> nodes) {
        this.pipelineName = pipelineName;
        this.nodes = List.copyOf(nodes);
        Map<String, InvocationNode> index = new LinkedHashMap<>();
        for (InvocationNode node : this.nodes) {
            index.put(node.invocationId(), node);
        }
        this.byId = Collections.unmodifiableMap(index);
    }

    public String getPipelineName() {
        return pipelineName;
    }

    public List<InvocationNode> getNodes() {
        return nodes;
    }

    /**
     * @throws IllegalArgumentException for an unknown invocation id
     */
    public InvocationNode getNode(String invocationId) {
        InvocationNode node = byId.get(invocationId);
        if (node == null) {
            throw new IllegalArgumentException("No step invocation '" + invocationId + "' in pipeline '" + pipelineName + "'");
        }
        return node;
    }

    public boolean contains(String invocationId) {
        return byId.containsKey(invocationId);
    }

    /** Invocation ids in execution order. */
    public List<String> getInvocationIds() {
        return nodes.stream().map(InvocationNode::invocationId).collect(Collectors.toList());
    }

    public int size() {
        return nodes.size();
    }

    @Override
    public String toString() {
        return "PipelineInvocationGraph{pipeline=" + pipelineName + ", invocations=" + getInvocationIds() + "}";
    }
}
