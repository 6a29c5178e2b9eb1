package com.phillippitts.streamasr;

import com.phillippitts.streamasr.config.properties.AsrServiceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        AsrServiceProperties.class
})
@EnableScheduling
public class StreamAsrApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamAsrApplication.class, args);
    }

}
