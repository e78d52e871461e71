package com.github.stormino.streamcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StreamCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamCoreApplication.class, args);
    }
}
