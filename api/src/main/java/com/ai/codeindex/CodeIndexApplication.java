package com.ai.codeindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CodeIndexApplication {

	public static void main(String[] args) {
		SpringApplication.run(CodeIndexApplication.class, args);
	}

}
