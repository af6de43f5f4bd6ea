package com.example.channelinsight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ChannelInsightApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChannelInsightApplication.class, args);
    }
}
