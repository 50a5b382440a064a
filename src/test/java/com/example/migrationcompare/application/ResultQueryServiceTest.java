package com.example.migrationcompare.application;

import com.example.migrationcompare.domain.ResultFilter;
import com.example.migrationcompare.domain.ResultPage;
import com.example.migrationcompare.domain.SortKey;
import com.example.migrationcompare.exception.JobNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResultQueryServiceTest {

    @Mock private ComparisonJobService jobService;
    @Mock private ResultStore resultStore;

    private ResultQueryService service;

    @BeforeEach
    void setUp() {
        service = new ResultQueryService(jobService, resultStore, 100);
    }

    @Test
    void sanitizesPagingAndParsesSortKeys() {
        when(resultStore.query(anyString(), anyList(), any(), anyInt(), anyInt()))
                .thenReturn(new ResultPage(List.of(), 0, 20, 0));

        ResultPage page = service.query(
                "job-1", Arrays.asList("field_name,desc", " ", null, "record_id_b"), ResultFilter.NONE, -4, 0);

        assertThat(page.pageSize()).isEqualTo(20);

        verify(resultStore)
                .query(
                        eq("job-1"),
                        eq(List.of(SortKey.desc("field_name"), SortKey.asc("record_id_b"))),
                        eq(ResultFilter.NONE),
                        eq(0),
                        eq(20));
    }

    @Test
    void capsPageSize() {
        when(resultStore.query(anyString(), anyList(), any(), anyInt(), anyInt()))
                .thenReturn(new ResultPage(List.of(), 3, 100, 0));

        service.query("job-1", null, null, 3, 5_000);

        verify(resultStore).query(eq("job-1"), eq(List.of()), eq(null), eq(3), eq(100));
    }

    @Test
    void unknownJobIsReportedBeforeQuerying() {
        when(jobService.getStatus("missing")).thenThrow(new JobNotFoundException("missing"));

        assertThatThrownBy(() -> service.query("missing", List.of(), ResultFilter.NONE, 0, 20))
                .isInstanceOf(JobNotFoundException.class);
        verifyNoInteractions(resultStore);
    }

    @Test
    void invalidSortDirectionIsRejected() {
        assertThatThrownBy(() -> service.query("job-1", List.of("field_name,sideways"), ResultFilter.NONE, 0, 20))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
