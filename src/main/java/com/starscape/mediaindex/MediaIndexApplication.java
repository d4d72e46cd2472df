package com.starscape.mediaindex;

import com.starscape.mediaindex.common.config.MediaProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MediaProperties.class)
public class MediaIndexApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaIndexApplication.class, args);
    }
}
