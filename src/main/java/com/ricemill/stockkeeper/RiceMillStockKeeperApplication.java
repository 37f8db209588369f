package com.ricemill.stockkeeper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RiceMillStockKeeperApplication {

	public static void main(String[] args) {
		SpringApplication.run(RiceMillStockKeeperApplication.class, args);
	}

}
