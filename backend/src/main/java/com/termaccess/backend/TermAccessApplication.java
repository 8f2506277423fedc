package com.termaccess.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TermAccessApplication {

	public static void main(String[] args) {
		// Audit timestamps and grant rebuild logs are written in UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(TermAccessApplication.class, args);
	}

}
