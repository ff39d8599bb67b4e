package com.worksrec;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorksRecApplication {
    public static void main(String[] args) {
        SpringApplication.run(WorksRecApplication.class, args);
    }
}
