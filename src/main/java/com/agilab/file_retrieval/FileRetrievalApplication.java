package com.agilab.file_retrieval;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FileRetrievalApplication {

    public static void main(String[] args) {
        SpringApplication.run(FileRetrievalApplication.class, args);
    }
}
