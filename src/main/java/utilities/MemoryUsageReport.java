package utilities;

/** Human-readable JOL report of one preprocessing structure plus its retained size in MiB. */
public record MemoryUsageReport(String report, double totalMiB) {}
