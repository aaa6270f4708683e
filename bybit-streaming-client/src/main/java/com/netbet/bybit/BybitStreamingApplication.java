package com.netbet.bybit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BybitStreamingApplication {

    public static void main(String[] args) {
        SpringApplication.run(BybitStreamingApplication.class, args);
    }
}
