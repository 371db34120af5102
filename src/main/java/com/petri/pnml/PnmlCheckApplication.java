package com.petri.pnml;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PnmlCheckApplication {
    public static void main(String[] args) {
        SpringApplication.run(PnmlCheckApplication.class, args);
    }
}
