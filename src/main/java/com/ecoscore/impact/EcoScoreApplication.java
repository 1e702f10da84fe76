package com.ecoscore.impact;

import com.ecoscore.impact.config.EcoScoreProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(EcoScoreProperties.class)
public class EcoScoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(EcoScoreApplication.class, args);
    }
}
