package com.autonomous.quota;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QuotaProxyApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuotaProxyApplication.class, args);
    }
}
