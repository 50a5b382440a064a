package com.example.migrationcompare.application;

/**
 * Assigns comparison keys to hash buckets. Both sides of a job use the same partition count, so a
 * key lands in the same bucket on either side.
 */
public final class KeyPartitioner {
    private KeyPartitioner() {}

    public static int partitionOf(String comparisonKey, int partitionCount) {
        return Math.floorMod(comparisonKey.hashCode(), partitionCount);
    }
}
