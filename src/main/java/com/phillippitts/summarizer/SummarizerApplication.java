package com.phillippitts.summarizer;

import com.phillippitts.summarizer.config.inference.InferenceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(InferenceProperties.class)
public class SummarizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SummarizerApplication.class, args);
    }

}
