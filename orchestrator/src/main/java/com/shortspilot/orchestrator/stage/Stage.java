package com.shortspilot.orchestrator.stage;

/** The three externally executed pipeline stages. */
public enum Stage {
    FETCH,
    TRANSFORM,
    PUBLISH
}
