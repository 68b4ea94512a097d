package io.barhistory.config;

public record HistoryConfig(
        int pullThreads,
        int initialBlockCapacity,
        int maxBarsPerBlock,
        int maxBarsPerBuild,
        long memoryBytes,
        int retryAttempts,
        long retryBaseMillis,
        long retryMaxMillis
) {
    public HistoryConfig {
        pullThreads = Math.max(1, pullThreads);
        initialBlockCapacity = Math.max(1, initialBlockCapacity);
        maxBarsPerBlock = Math.max(initialBlockCapacity, maxBarsPerBlock);
        maxBarsPerBuild = Math.max(0, maxBarsPerBuild);
        memoryBytes = Math.max(0, memoryBytes);
        retryAttempts = Math.max(1, retryAttempts);
    }

    public static HistoryConfig defaults() {
        return new HistoryConfig(4, 256, 65_536, 50_000_000, 512L * 1024 * 1024, 3, 10, 500);
    }

    public static HistoryConfig fromEnv() {
        int threads = Integer.parseInt(System.getProperty("barhistory.pullThreads", System.getenv().getOrDefault("BARHISTORY_PULL_THREADS", "4")));
        int initial = Integer.parseInt(System.getProperty("barhistory.blockInitial", System.getenv().getOrDefault("BARHISTORY_BLOCK_INITIAL", "256")));
        int perBlock = Integer.parseInt(System.getProperty("barhistory.blockMax", System.getenv().getOrDefault("BARHISTORY_BLOCK_MAX", "65536")));
        int perBuild = Integer.parseInt(System.getProperty("barhistory.buildMaxBars", System.getenv().getOrDefault("BARHISTORY_BUILD_MAX_BARS", "50000000")));
        long mem = Long.parseLong(System.getProperty("barhistory.mem", System.getenv().getOrDefault("BARHISTORY_MEM", "536870912")));
        int attempts = Integer.parseInt(System.getProperty("barhistory.retry.attempts", System.getenv().getOrDefault("BARHISTORY_RETRY_ATTEMPTS", "3")));
        long base = Long.parseLong(System.getProperty("barhistory.retry.baseMillis", System.getenv().getOrDefault("BARHISTORY_RETRY_BASE_MILLIS", "10")));
        long max = Long.parseLong(System.getProperty("barhistory.retry.maxMillis", System.getenv().getOrDefault("BARHISTORY_RETRY_MAX_MILLIS", "500")));
        return new HistoryConfig(threads, initial, perBlock, perBuild, mem, attempts, base, max);
    }

    public HistoryConfig withMemoryBytes(long bytes) {
        return new HistoryConfig(pullThreads, initialBlockCapacity, maxBarsPerBlock, maxBarsPerBuild, bytes, retryAttempts, retryBaseMillis, retryMaxMillis);
    }

    public HistoryConfig withBlockSizes(int initial, int max) {
        return new HistoryConfig(pullThreads, initial, max, maxBarsPerBuild, memoryBytes, retryAttempts, retryBaseMillis, retryMaxMillis);
    }
}
