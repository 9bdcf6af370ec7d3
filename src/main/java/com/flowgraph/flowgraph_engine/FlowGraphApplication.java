package com.flowgraph.flowgraph_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlowGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowGraphApplication.class, args);
    }
}
