package com.phylotree;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PhyloTreeApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhyloTreeApplication.class, args);
    }
}
