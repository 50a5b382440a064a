package com.example.migrationcompare.domain;

import java.util.List;

public record ResultPage(
        List<DifferenceRecord> records, int page, int pageSize, long totalCount) {
    public ResultPage {
        records = List.copyOf(records);
    }

    public int totalPages() {
        return pageSize == 0 ? 0 : (int) ((totalCount + pageSize - 1) / pageSize);
    }

    public boolean hasNext() {
        return page + 1 < totalPages();
    }
}
