package com.modelsync.core.operation;

import com.modelsync.core.diagram.DiagramContext;
import com.modelsync.core.model.DiagramEdge;

import java.util.List;
import java.util.Map;

/**
 * Turns diagram-level changes into source text edits.
 *
 * <p>The materializer knows the concrete syntax of the language. When it fails the
 * requesting operation is aborted and the diagram stays untouched.
 */
public interface TextMaterializer {

    /**
     * Produces the text for a new node.
     *
     * @param context document context
     * @param astType AST type of the new element
     * @param name unique name of the new element
     * @param containerId containing node element ID, null for top level
     * @param args operation arguments
     * @return edits or failure
     */
    MaterializeResult createNode(DiagramContext context, String astType, String name, String containerId,
                                 Map<String, Object> args);

    /**
     * Produces the text for a new reference.
     *
     * @param context document context
     * @param edgeType diagram edge type
     * @param property AST field the reference is written to
     * @param sourceId source node element ID
     * @param targetId target node element ID
     * @param args operation arguments
     * @return edits or failure
     */
    MaterializeResult createEdge(DiagramContext context, String edgeType, String property, String sourceId,
                                 String targetId, Map<String, Object> args);

    /**
     * Produces the text edits removing elements.
     *
     * @param context document context
     * @param elementIds nodes and edges being deleted
     * @return edits or failure
     */
    MaterializeResult deleteElements(DiagramContext context, List<String> elementIds);

    /**
     * Produces the text edits moving a reference to new endpoints. The default keeps the
     * text unchanged.
     *
     * @param context document context
     * @param previous edge before the change
     * @param updated edge after the change
     * @return edits or failure
     */
    default MaterializeResult reconnectEdge(DiagramContext context, DiagramEdge previous, DiagramEdge updated) {
        return MaterializeResult.noEdits();
    }
}
