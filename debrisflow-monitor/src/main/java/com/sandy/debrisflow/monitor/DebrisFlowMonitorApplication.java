package com.sandy.debrisflow.monitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableRetry
@EnableScheduling
@ConfigurationPropertiesScan
@SpringBootApplication
public class DebrisFlowMonitorApplication {

	public static void main(String[] args) {
		SpringApplication.run(DebrisFlowMonitorApplication.class, args);
	}

}
