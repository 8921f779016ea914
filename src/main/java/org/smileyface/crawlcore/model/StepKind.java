package org.smileyface.crawlcore.model;

/**
 * How a step's backlog is stored: keyed work items, or a discovery frontier of addresses.
 */
public enum StepKind {
    QUEUE,
    FRONTIER
}
