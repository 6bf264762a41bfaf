package com.yunhwan.catalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CatalogEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(CatalogEngineApplication.class, args);
	}

}
