package com.shortspilot.orchestrator.stage;

import com.shortspilot.orchestrator.model.WorkItem;

/** Downloads the source video of a DISCOVERED item. */
public interface FetchStage extends StageExecutor<WorkItem, FetchedSource> {

    @Override
    default Stage stage() { return Stage.FETCH; }
}
