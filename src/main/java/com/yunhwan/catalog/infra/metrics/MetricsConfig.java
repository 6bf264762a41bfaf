package com.yunhwan.catalog.infra.metrics;

public final class MetricsConfig {

    private MetricsConfig() {}

    public static final String METRIC_COMMAND = "catalog.command";
    public static final String METRIC_QUERY = "catalog.query";
    public static final String METRIC_DEAD_LETTER = "catalog.event_bus.dead_letter";
    public static final String METRIC_DEAD_LETTER_SIZE = "catalog.event_bus.dead_letter.size";
    public static final String METRIC_CACHE_REQUESTS = "catalog.cache.requests";
    public static final String METRIC_LOADER_BATCH = "catalog.loader.batch";

    // 고카디널리티 금지(aggregateId/sku/key 제외)
    public static final String TAG_COMMAND_TYPE = "command_type";
    public static final String TAG_QUERY_TYPE = "query_type";
    public static final String TAG_EVENT_TYPE = "event_type";
    public static final String TAG_RESULT = "result";
    public static final String TAG_CACHE = "cache";
    public static final String TAG_TIER = "tier";

    public static final String RESULT_SUCCESS = "success";
    public static final String RESULT_REJECTED = "rejected";
    public static final String RESULT_ERROR = "error";
    public static final String RESULT_HIT = "hit";
    public static final String RESULT_MISS = "miss";

    public static final String TIER_L1 = "l1";
    public static final String TIER_L2 = "l2";
}
