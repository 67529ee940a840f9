package com.tsc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WorkshopRegistrationApplication {

	public static void main(String[] args) {
		SpringApplication.run(WorkshopRegistrationApplication.class, args);
	}

}
