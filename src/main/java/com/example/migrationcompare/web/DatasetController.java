package com.example.migrationcompare.web;

import com.example.migrationcompare.application.DatasetBrowseService;
import com.example.migrationcompare.exception.ConfigurationException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.Map;

@RestController
@RequestMapping("/api/datasets")
public class DatasetController {
    private final DatasetBrowseService browseService;

    public DatasetController(DatasetBrowseService browseService) {
        this.browseService = browseService;
    }

    @PostMapping("/records")
    public DatasetBrowseService.RecordPage records(@RequestBody BrowseDatasetRequest request)
            throws IOException {
        if (request.getDataset() == null) {
            throw new ConfigurationException("Dataset descriptor is required");
        }
        return browseService.browse(request.getDataset(), request.getPage(), request.getSize());
    }

    @DeleteMapping("/cache")
    public Map<String, Integer> evictAll() {
        return Map.of("evicted", browseService.evictAll());
    }

    @DeleteMapping("/cache/{name}")
    public Map<String, Boolean> evict(@PathVariable("name") String name) {
        return Map.of("evicted", browseService.evict(name));
    }
}
