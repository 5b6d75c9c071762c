package com.shortspilot.orchestrator.stage;

/** Uploads one segment and returns its id on the remote platform. */
public interface PublishStage extends StageExecutor<PublishRequest, String> {

    @Override
    default Stage stage() { return Stage.PUBLISH; }
}
