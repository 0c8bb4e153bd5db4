package com.starscape.phototriage;

import com.starscape.phototriage.common.config.TriageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(TriageProperties.class)
public class PhotoTriageApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhotoTriageApplication.class, args);
    }
}
