package io.cqstats.collector.model;

public record StreamStats(String streamName, StreamCounters counters) {
}
