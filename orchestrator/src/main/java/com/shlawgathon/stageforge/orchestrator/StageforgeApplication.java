package com.shlawgathon.stageforge.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StageforgeApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(StageforgeApplication.class, args)));
    }
}
