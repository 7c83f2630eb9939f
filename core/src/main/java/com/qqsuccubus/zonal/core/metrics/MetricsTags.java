package com.qqsuccubus.zonal.core.metrics;

/**
 * Tag keys and values shared by the metrics in {@link MetricsNames}.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String BACKEND = "backend";
    public static final String ZONE = "zone";
    public static final String HOME_ZONE = "home_zone";
    public static final String LOCALITY = "locality";

    public static final String IN_ZONE = "in_zone";
    public static final String CROSS_ZONE = "cross_zone";
}
