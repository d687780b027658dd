package utilities;

/** Human-readable footprint line for a transition table plus its total in MiB. */
public record MemoryUsageReport(String report, double totalMiB) {}
