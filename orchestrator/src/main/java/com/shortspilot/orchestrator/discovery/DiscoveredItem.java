package com.shortspilot.orchestrator.discovery;

/**
 * A candidate source reported by discovery.
 *
 * @param priority popularity metric; higher is processed first
 */
public record DiscoveredItem(String id, long priority, String title, String sourceUrl) {}
