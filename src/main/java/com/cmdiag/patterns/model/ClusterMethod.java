package com.cmdiag.patterns.model;

/**
 * Unsupervised method that produced a discovered cluster.
 */
public enum ClusterMethod {
    KMEANS("kmeans"),
    DBSCAN("dbscan");

    private final String prefix;

    ClusterMethod(String prefix) {
        this.prefix = prefix;
    }

    public String clusterId(int index) {
        return prefix + "-" + index;
    }
}
