package com.modelsync.core.operation.impl;

import com.modelsync.core.diagram.DiagramContext;
import com.modelsync.core.model.DiagramEdge;
import com.modelsync.core.operation.MaterializeResult;
import com.modelsync.core.operation.TextMaterializer;

import java.util.List;
import java.util.Map;

/**
 * Materializer that refuses every request.
 */
final class FailingMaterializer implements TextMaterializer {

    private final String reason;

    FailingMaterializer(String reason) {
        this.reason = reason;
    }

    @Override
    public MaterializeResult createNode(DiagramContext context, String astType, String name, String containerId,
                                        Map<String, Object> args) {
        return MaterializeResult.failed(reason);
    }

    @Override
    public MaterializeResult createEdge(DiagramContext context, String edgeType, String property, String sourceId,
                                        String targetId, Map<String, Object> args) {
        return MaterializeResult.failed(reason);
    }

    @Override
    public MaterializeResult deleteElements(DiagramContext context, List<String> elementIds) {
        return MaterializeResult.failed(reason);
    }

    @Override
    public MaterializeResult reconnectEdge(DiagramContext context, DiagramEdge previous, DiagramEdge updated) {
        return MaterializeResult.failed(reason);
    }
}
