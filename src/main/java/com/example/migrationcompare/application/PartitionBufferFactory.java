package com.example.migrationcompare.application;

import java.io.IOException;

@FunctionalInterface
public interface PartitionBufferFactory {

    PartitionBuffer create(String jobId, String side, int partitionCount) throws IOException;
}
