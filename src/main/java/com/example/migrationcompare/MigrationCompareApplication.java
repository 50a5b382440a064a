package com.example.migrationcompare;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MigrationCompareApplication {

    public static void main(String[] args) {
        SpringApplication.run(MigrationCompareApplication.class, args);
    }
}
