package com.company.watchdog;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@OpenAPIDefinition(
        info = @Info(
                title = "Data Watchdog API",
                version = "1.0.0",
                description = "Scheduled event-count checks with audit and reporting"
        )
)
public class WatchdogServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(WatchdogServiceApplication.class, args);
    }
}
