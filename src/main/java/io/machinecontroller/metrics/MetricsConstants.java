package io.machinecontroller.metrics;

/**
 * Constants for metrics names and tags used in the Machine Controller.
 */
public class MetricsConstants {
    public final static String NODE_GROUPS_DISCOVERED_METRIC_NAME = "node_groups_discovered";
    public final static String NODE_GROUP_LIST_LATENCY_METRIC_NAME = "node_group_list_latency";
    public final static String NODE_GROUP_CONFIGURATION_ERRORS_METRIC_NAME = "node_group_configuration_errors";
    public final static String NODE_GROUP_RESIZE_METRIC_NAME = "node_group_resize";
    public final static String CACHE_EVENTS_METRIC_NAME = "resource_cache_events";
    public final static String CACHE_RESYNC_METRIC_NAME = "resource_cache_resyncs";
    public final static String CLUSTER_NAME_TAG = "clusterName";
    public final static String KIND_TAG = "kind";
    public final static String EVENT_TYPE_TAG = "eventType";
    public final static String NODE_GROUP_TAG = "nodeGroup";

    private MetricsConstants() {}
}
