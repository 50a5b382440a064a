package com.example.migrationcompare.web;

import com.example.migrationcompare.application.ComparisonJobService;
import com.example.migrationcompare.application.MappingResolver;
import com.example.migrationcompare.application.ResultQueryService;
import com.example.migrationcompare.domain.ComparisonJob;
import com.example.migrationcompare.domain.DifferenceType;
import com.example.migrationcompare.domain.JobStatus;
import com.example.migrationcompare.domain.ResultFilter;
import com.example.migrationcompare.domain.ResultPage;
import com.example.migrationcompare.exception.ConfigurationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import jakarta.servlet.http.HttpServletRequest;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/api/jobs")
public class ComparisonJobController {
    private final ComparisonJobService jobService;
    private final ResultQueryService resultQueryService;
    private final MappingResolver mappingResolver;

    public ComparisonJobController(
            ComparisonJobService jobService,
            ResultQueryService resultQueryService,
            MappingResolver mappingResolver) {
        this.jobService = jobService;
        this.resultQueryService = resultQueryService;
        this.mappingResolver = mappingResolver;
    }

    @PostMapping
    public ResponseEntity<JobSubmittedResponse> submit(@RequestBody SubmitComparisonRequest request) {
        return accepted(jobService.submit(request.toComparisonRequest()));
    }

    @PostMapping("/from-mapping")
    public ResponseEntity<JobSubmittedResponse> submitFromMapping(
            @RequestBody SubmitFromMappingRequest request) throws IOException {
        if (request.getMappingLocation() == null || request.getMappingLocation().isBlank()) {
            throw new ConfigurationException("Mapping location is required");
        }
        return accepted(jobService.submit(mappingResolver.resolve(request.getMappingLocation())));
    }

    @GetMapping
    public List<ComparisonJob> list(
            @RequestParam(name = "dataset", required = false) String dataset,
            @RequestParam(name = "status", required = false) String status) {
        JobStatus statusFilter = status == null || status.isBlank() ? null : JobStatus.fromValue(status);
        return jobService.listJobs(dataset, statusFilter);
    }

    @GetMapping("/{jobId}")
    public ComparisonJob status(@PathVariable("jobId") String jobId) {
        return jobService.getStatus(jobId);
    }

    @PostMapping("/{jobId}/cancel")
    public ComparisonJob cancel(@PathVariable("jobId") String jobId) {
        return jobService.cancel(jobId);
    }

    @DeleteMapping("/{jobId}")
    public ResponseEntity<Void> delete(@PathVariable("jobId") String jobId) {
        jobService.delete(jobId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{jobId}/results")
    public ResultPage results(
            @PathVariable("jobId") String jobId,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size,
            @RequestParam(name = "type", required = false) DifferenceType type,
            @RequestParam(name = "field", required = false) String field,
            HttpServletRequest httpRequest) {
        // read raw values so "column,desc" is not split into two sort entries
        String[] sort = httpRequest.getParameterValues("sort");
        List<String> sortKeys = sort == null ? List.of() : Arrays.asList(sort);
        return resultQueryService.query(jobId, sortKeys, new ResultFilter(type, field), page, size);
    }

    private static ResponseEntity<JobSubmittedResponse> accepted(String jobId) {
        String statusLocation = "/api/jobs/" + jobId;
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .header("Location", statusLocation)
                .body(new JobSubmittedResponse(jobId, statusLocation, statusLocation + "/results"));
    }
}
