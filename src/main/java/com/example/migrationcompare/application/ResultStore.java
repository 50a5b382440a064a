package com.example.migrationcompare.application;

import com.example.migrationcompare.domain.DifferenceRecord;
import com.example.migrationcompare.domain.ResultFilter;
import com.example.migrationcompare.domain.ResultPage;
import com.example.migrationcompare.domain.SortKey;

import java.io.IOException;
import java.util.List;

/**
 * Append-only store of difference rows, isolated per job.
 */
public interface ResultStore {

    /**
     * Durably appends one partition's rows. A failed call leaves earlier partitions intact.
     */
    void write(String jobId, int partition, List<DifferenceRecord> rows) throws IOException;

    /**
     * Returns one page in the requested order. An empty sort list means the default report order.
     *
     * @param page zero-based page index
     */
    ResultPage query(String jobId, List<SortKey> sortKeys, ResultFilter filter, int page, int pageSize);

    long count(String jobId);

    void deleteByJob(String jobId);

    /** Where the rows of a job can be found, recorded on the job. */
    String locationOf(String jobId);
}
