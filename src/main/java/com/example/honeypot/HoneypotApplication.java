package com.example.honeypot;

import com.example.honeypot.config.HoneypotProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(HoneypotProperties.class)
public class HoneypotApplication {

    public static void main(String[] args) {
        SpringApplication.run(HoneypotApplication.class, args);
    }
}
