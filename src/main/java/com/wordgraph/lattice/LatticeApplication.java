package com.wordgraph.lattice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LatticeApplication {

    public static void main(String[] args) {
        SpringApplication.run(LatticeApplication.class, args);
    }
}
