package com.example.migrationcompare.web;

import com.example.migrationcompare.domain.DatasetDescriptor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class BrowseDatasetRequest {
    private DatasetDescriptor dataset;
    private int page;
    private int size = 20;
}
