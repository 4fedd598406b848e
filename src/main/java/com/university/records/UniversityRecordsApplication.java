package com.university.records;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UniversityRecordsApplication {
    public static void main(String[] args) {
        SpringApplication.run(UniversityRecordsApplication.class, args);
    }
}
