package com.shortspilot.orchestrator.stage;

import com.shortspilot.orchestrator.model.Segment;
import com.shortspilot.orchestrator.model.WorkItem;

/** Input of the publish stage: one segment of a TRANSFORMED item. */
public record PublishRequest(WorkItem item, Segment segment, PublishMetadata metadata) {}
