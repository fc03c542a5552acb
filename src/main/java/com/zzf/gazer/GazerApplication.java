package com.zzf.gazer;

import com.zzf.gazer.config.AiProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AiProperties.class)
public class GazerApplication {

    public static void main(String[] args) {
        SpringApplication.run(GazerApplication.class, args);
    }
}
