package com.hmmtagger.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HmmTaggerApplication {

    public static void main(String[] args) {
        SpringApplication.run(HmmTaggerApplication.class, args);
    }
}
