package com.catalog.reconciliation.merge;

import java.util.List;

/**
 * Records that collapsed to one key but do not look like the same product. They are
 * published under suffixed keys until a reviewer merges or splits them.
 *
 * @param productKey     the contested key
 * @param productKeys    keys the clusters were published under, in order
 * @param sourceIds      representative source id of each cluster
 * @param names          representative cleaned name of each cluster
 * @param similarity     name similarity of the first two representatives
 * @param splitConfirmed a reviewer already confirmed the split
 */
public record KeyCollision(String productKey, List<String> productKeys, List<String> sourceIds,
                           List<String> names, double similarity, boolean splitConfirmed) {

    public KeyCollision {
        productKeys = List.copyOf(productKeys);
        sourceIds = List.copyOf(sourceIds);
        names = List.copyOf(names);
    }
}
