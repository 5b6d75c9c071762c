package com.shortspilot.orchestrator.discovery;

import java.util.List;

/** Lists candidate sources. May return items that are already tracked. */
public interface DiscoverySource {

    List<DiscoveredItem> discover();
}
