package com.example.series_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class SeriesBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(SeriesBackendApplication.class, args);
	}

}
