package com.example.migrationcompare.web;

import com.example.migrationcompare.application.ComparisonJobService;
import com.example.migrationcompare.application.MappingResolver;
import com.example.migrationcompare.application.ResultQueryService;
import com.example.migrationcompare.domain.ComparisonRequest;
import com.example.migrationcompare.domain.DifferenceType;
import com.example.migrationcompare.domain.JobStatus;
import com.example.migrationcompare.domain.ResultFilter;
import com.example.migrationcompare.domain.ResultPage;
import com.example.migrationcompare.exception.ConfigurationException;
import com.example.migrationcompare.exception.JobNotFoundException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ComparisonJobController.class)
class ComparisonJobControllerTests {

    @Autowired private MockMvc mockMvc;

    @MockBean private ComparisonJobService jobService;
    @MockBean private ResultQueryService resultQueryService;
    @MockBean private MappingResolver mappingResolver;

    @Test
    void submitReturnsAcceptedWithJobId() throws Exception {
        when(jobService.submit(any(ComparisonRequest.class))).thenReturn("job-1");

        mockMvc.perform(post("/api/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "source": {"name": "a", "locations": ["a.csv"], "primaryKeys": ["ID"], "valueColumns": ["QTY"]},
                                  "target": {"name": "b", "locations": ["b.csv"], "primaryKeys": ["ID"], "valueColumns": ["QTY"]},
                                  "settings": {"numericTolerance": 0}
                                }
                                """))
                .andExpect(status().isAccepted())
                .andExpect(header().string("Location", "/api/jobs/job-1"))
                .andExpect(jsonPath("$.jobId").value("job-1"))
                .andExpect(jsonPath("$.resultLocation").value("/api/jobs/job-1/results"));
    }

    @Test
    void missingSettingsAreABadRequest() throws Exception {
        mockMvc.perform(post("/api/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\": {\"name\": \"a\"}, \"target\": {\"name\": \"b\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.problems[0]").value("Comparison settings are required"));
        verify(jobService, never()).submit(any());
    }

    @Test
    void configurationProblemsAreListed() throws Exception {
        when(mappingResolver.resolve("m.json"))
                .thenThrow(new ConfigurationException(List.of("first problem", "second problem")));

        mockMvc.perform(post("/api/jobs/from-mapping")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mappingLocation\": \"m.json\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.problems.length()").value(2));
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        when(jobService.getStatus("nope")).thenThrow(new JobNotFoundException("nope"));

        mockMvc.perform(get("/api/jobs/nope")).andExpect(status().isNotFound());
    }

    @Test
    void deletingARunningJobConflicts() throws Exception {
        doThrow(new IllegalStateException("Job job-1 is running and cannot be deleted"))
                .when(jobService).delete("job-1");

        mockMvc.perform(delete("/api/jobs/job-1")).andExpect(status().isConflict());
    }

    @Test
    void listAcceptsLowerCaseStatus() throws Exception {
        when(jobService.listJobs("accounts", JobStatus.RUNNING)).thenReturn(List.of());

        mockMvc.perform(get("/api/jobs").param("dataset", "accounts").param("status", "running"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }

    @Test
    @SuppressWarnings("unchecked")
    void resultsKeepSortDirectionsTogether() throws Exception {
        when(resultQueryService.query(eq("job-1"), anyList(), any(), anyInt(), anyInt()))
                .thenReturn(new ResultPage(List.of(), 1, 10, 0));

        mockMvc.perform(get("/api/jobs/job-1/results")
                        .param("page", "1")
                        .param("size", "10")
                        .param("sort", "field_name,desc")
                        .param("sort", "record_id_b")
                        .param("type", "VALUE_MISMATCH"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.page").value(1))
                .andExpect(jsonPath("$.totalCount").value(0));

        ArgumentCaptor<List<String>> sortCaptor = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<ResultFilter> filterCaptor = ArgumentCaptor.forClass(ResultFilter.class);
        verify(resultQueryService).query(eq("job-1"), sortCaptor.capture(), filterCaptor.capture(), eq(1), eq(10));
        assertThat(sortCaptor.getValue()).containsExactly("field_name,desc", "record_id_b");
        assertThat(filterCaptor.getValue().differenceType()).isEqualTo(DifferenceType.VALUE_MISMATCH);
    }
}
