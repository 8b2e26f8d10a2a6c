package com.yerin.retrydlq;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RetryDlqApplication {

	public static void main(String[] args) {
		SpringApplication.run(RetryDlqApplication.class, args);
	}

}
