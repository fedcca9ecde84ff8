package com.flowsmith.core.graph;

import com.flowsmith.core.nodes.DetectAmbiguitiesNode;
import com.flowsmith.core.nodes.GroundNode;
import com.flowsmith.core.nodes.ResolveMetadataNode;
import com.flowsmith.core.nodes.UnderstandNode;
import com.flowsmith.core.state.GenerationState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Stage one graph.
 * <pre>
 *   START -> understand -> resolve_metadata -> ground -> detect_ambiguities -> END
 * </pre>
 * Any node that records an error routes straight to END.
 */
@Component
public class GenerationGraph {

    private static final Logger log = LoggerFactory.getLogger(GenerationGraph.class);

    private final CompiledGraph<GenerationState> compiledGraph;

    public GenerationGraph(UnderstandNode understandNode,
                           ResolveMetadataNode resolveMetadataNode,
                           GroundNode groundNode,
                           DetectAmbiguitiesNode detectAmbiguitiesNode) throws Exception {

        var graph = new StateGraph<>(GenerationState.SCHEMA, GenerationState::new)
                .addNode("understand", node_async(understandNode::apply))
                .addNode("resolve_metadata", node_async(resolveMetadataNode::apply))
                .addNode("ground", node_async(groundNode::apply))
                .addNode("detect_ambiguities", node_async(detectAmbiguitiesNode::apply))
                .addEdge(START, "understand")
                .addConditionalEdges("understand",
                        edge_async(state -> continueUnlessFailed(state, "resolve_metadata")),
                        Map.of("resolve_metadata", "resolve_metadata", END, END))
                .addConditionalEdges("resolve_metadata",
                        edge_async(state -> continueUnlessFailed(state, "ground")),
                        Map.of("ground", "ground", END, END))
                .addConditionalEdges("ground",
                        edge_async(state -> continueUnlessFailed(state, "detect_ambiguities")),
                        Map.of("detect_ambiguities", "detect_ambiguities", END, END))
                .addEdge("detect_ambiguities", END);

        this.compiledGraph = graph.compile(CompileConfig.builder().build());
        log.info("Generation graph compiled");
    }

    static String continueUnlessFailed(GenerationState state, String next) {
        return state.hasErrors() ? END : next;
    }

    public CompiledGraph<GenerationState> getCompiledGraph() {
        return compiledGraph;
    }
}
