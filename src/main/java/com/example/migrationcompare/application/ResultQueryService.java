package com.example.migrationcompare.application;

import com.example.migrationcompare.domain.ResultFilter;
import com.example.migrationcompare.domain.ResultPage;
import com.example.migrationcompare.domain.SortKey;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Paged, sorted access to the difference rows of one job.
 */
@Service
public class ResultQueryService {
    private static final int DEFAULT_PAGE_SIZE = 20;

    private final ComparisonJobService jobService;
    private final ResultStore resultStore;
    private final int maxPageSize;

    public ResultQueryService(
            ComparisonJobService jobService,
            ResultStore resultStore,
            @Value("${comparison.results.max-page-size:100}") int maxPageSize) {
        this.jobService = jobService;
        this.resultStore = resultStore;
        this.maxPageSize = Math.max(1, maxPageSize);
    }

    /**
     * @param sort entries of the form {@code column} or {@code column,asc|desc}; empty means the
     *     default report order
     * @throws com.example.migrationcompare.exception.JobNotFoundException for an unknown job
     */
    public ResultPage query(String jobId, List<String> sort, ResultFilter filter, int page, int size) {
        jobService.getStatus(jobId);
        return resultStore.query(jobId, parseSort(sort), filter, sanitizePage(page), sanitizeSize(size));
    }

    static List<SortKey> parseSort(List<String> sort) {
        List<SortKey> keys = new ArrayList<>();
        if (sort == null) {
            return keys;
        }
        for (String expression : sort) {
            if (expression != null && !expression.isBlank()) {
                keys.add(SortKey.parse(expression));
            }
        }
        return keys;
    }

    private int sanitizePage(int page) {
        return Math.max(page, 0);
    }

    private int sanitizeSize(int requestedSize) {
        if (requestedSize <= 0) {
            return Math.min(DEFAULT_PAGE_SIZE, maxPageSize);
        }
        return Math.min(requestedSize, maxPageSize);
    }
}
