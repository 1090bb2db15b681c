package com.study.webflux.funnel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FunnelPresentationApplication {

	public static void main(String[] args) {
		SpringApplication.run(FunnelPresentationApplication.class, args);
	}
}
