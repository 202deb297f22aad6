package com.bubblelevel.replay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BubbleReplayApplication {

    public static void main(String[] args) {
        SpringApplication.run(BubbleReplayApplication.class, args);
    }
}
