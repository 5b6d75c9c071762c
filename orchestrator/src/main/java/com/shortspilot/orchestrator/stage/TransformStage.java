package com.shortspilot.orchestrator.stage;

import com.shortspilot.orchestrator.model.Segment;

import java.util.List;

/** Cuts and renders the planned segments of a FETCHED item. */
public interface TransformStage extends StageExecutor<TransformRequest, List<Segment>> {

    @Override
    default Stage stage() { return Stage.TRANSFORM; }
}
