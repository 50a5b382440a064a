package com.example.migrationcompare.web;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class SubmitFromMappingRequest {
    private String mappingLocation;
}
