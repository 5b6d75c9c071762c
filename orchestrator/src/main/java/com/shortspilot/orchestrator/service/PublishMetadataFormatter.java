package com.shortspilot.orchestrator.service;

import com.shortspilot.orchestrator.config.PublishProperties;
import com.shortspilot.orchestrator.model.Segment;
import com.shortspilot.orchestrator.model.WorkItem;
import com.shortspilot.orchestrator.stage.PublishMetadata;

/**
 * Builds the title and description of a published segment.
 *
 * Titles read "&lt;source title&gt; - Part N". Sources with long titles are cut
 * to 90 characters plus an ellipsis so the part suffix always survives the
 * platform's title limit.
 */
public class PublishMetadataFormatter {

    static final int MAX_TITLE_LENGTH = 95;
    static final int TRUNCATED_LENGTH = 90;

    private final PublishProperties props;

    public PublishMetadataFormatter(PublishProperties props) {
        this.props = props;
    }

    public PublishMetadata format(WorkItem item, Segment segment) {
        String title  = item.getTitle() == null ? item.getId() : item.getTitle();
        int    part   = segment.index();
        int    total  = item.getSegments().size();

        String titleText = title + " - Part " + part;
        if (titleText.length() > MAX_TITLE_LENGTH) {
            titleText = title.substring(0, Math.min(title.length(), TRUNCATED_LENGTH)) + "... - Part " + part;
        }
        if (!props.hashtags().isEmpty()) {
            titleText = titleText + " " + String.join(" ", props.hashtags());
        }

        String description = props.descriptionTemplate()
                .replace("{title}", title)
                .replace("{part}",  String.valueOf(part))
                .replace("{total}", String.valueOf(total))
                .replace("{url}",   item.getSourceUrl() == null ? "" : item.getSourceUrl());

        return new PublishMetadata(titleText, description, props.tags());
    }
}
