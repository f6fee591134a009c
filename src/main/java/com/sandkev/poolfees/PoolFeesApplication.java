package com.sandkev.poolfees;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PoolFeesApplication {

	public static void main(String[] args) {
		SpringApplication.run(PoolFeesApplication.class, args);
	}

}
