package com.fakebusters.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FakebustersApplication {

	public static void main(String[] args) {
		// Board timestamps and audit rows are compared in UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(FakebustersApplication.class, args);
	}

}
