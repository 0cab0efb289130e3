package com.hotride.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HotRideAuthApplication {

	public static void main(String[] args) {
		SpringApplication.run(HotRideAuthApplication.class, args);
	}

}
