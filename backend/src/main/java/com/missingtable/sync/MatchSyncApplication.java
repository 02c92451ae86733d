package com.missingtable.sync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MatchSyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(MatchSyncApplication.class, args);
    }
}
