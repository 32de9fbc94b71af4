package com.purchasingpower.graphrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GraphRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(GraphRagApplication.class, args);
    }
}
