package com.ats;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@ConfigurationPropertiesScan({"com.ats.shared.config", "com.ats.payment.config"})
@EnableAsync
public class ResumeAtsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResumeAtsApplication.class, args);
    }
}
