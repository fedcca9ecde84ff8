package com.flowsmith.core.graph;

import com.flowsmith.core.nodes.ApplyDecisionsNode;
import com.flowsmith.core.nodes.CompileNode;
import com.flowsmith.core.nodes.FormalizeNode;
import com.flowsmith.core.nodes.PostProcessNode;
import com.flowsmith.core.nodes.ValidateIrNode;
import com.flowsmith.core.nodes.ValidateWorkflowNode;
import com.flowsmith.core.state.CompilationState;
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
 * Stage two graph.
 * <pre>
 *   START -> apply_decisions -> formalize -> validate_ir -> compile
 *         -> post_process -> validate_workflow -> END
 * </pre>
 * Any node that records an error routes straight to END.
 */
@Component
public class CompilationGraph {

    private static final Logger log = LoggerFactory.getLogger(CompilationGraph.class);

    private final CompiledGraph<CompilationState> compiledGraph;

    public CompilationGraph(ApplyDecisionsNode applyDecisionsNode,
                            FormalizeNode formalizeNode,
                            ValidateIrNode validateIrNode,
                            CompileNode compileNode,
                            PostProcessNode postProcessNode,
                            ValidateWorkflowNode validateWorkflowNode) throws Exception {

        var graph = new StateGraph<>(CompilationState.SCHEMA, CompilationState::new)
                .addNode("apply_decisions", node_async(applyDecisionsNode::apply))
                .addNode("formalize", node_async(formalizeNode::apply))
                .addNode("validate_ir", node_async(validateIrNode::apply))
                .addNode("compile", node_async(compileNode::apply))
                .addNode("post_process", node_async(postProcessNode::apply))
                .addNode("validate_workflow", node_async(validateWorkflowNode::apply))
                .addEdge(START, "apply_decisions")
                .addConditionalEdges("apply_decisions",
                        edge_async(state -> continueUnlessFailed(state, "formalize")),
                        Map.of("formalize", "formalize", END, END))
                .addConditionalEdges("formalize",
                        edge_async(state -> continueUnlessFailed(state, "validate_ir")),
                        Map.of("validate_ir", "validate_ir", END, END))
                .addConditionalEdges("validate_ir",
                        edge_async(state -> continueUnlessFailed(state, "compile")),
                        Map.of("compile", "compile", END, END))
                .addConditionalEdges("compile",
                        edge_async(state -> continueUnlessFailed(state, "post_process")),
                        Map.of("post_process", "post_process", END, END))
                .addConditionalEdges("post_process",
                        edge_async(state -> continueUnlessFailed(state, "validate_workflow")),
                        Map.of("validate_workflow", "validate_workflow", END, END))
                .addEdge("validate_workflow", END);

        this.compiledGraph = graph.compile(CompileConfig.builder().build());
        log.info("Compilation graph compiled");
    }

    static String continueUnlessFailed(CompilationState state, String next) {
        return state.hasErrors() ? END : next;
    }

    public CompiledGraph<CompilationState> getCompiledGraph() {
        return compiledGraph;
    }
}
