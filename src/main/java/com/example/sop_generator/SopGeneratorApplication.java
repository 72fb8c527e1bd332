package com.example.sop_generator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SopGeneratorApplication {

	public static void main(String[] args) {
		SpringApplication.run(SopGeneratorApplication.class, args);
	}

}
