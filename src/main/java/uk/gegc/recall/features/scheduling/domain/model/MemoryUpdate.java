package uk.gegc.recall.features.scheduling.domain.model;

public record MemoryUpdate(double stability, double difficulty) {
}
