package com.bracketscan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * BracketScan - angle-bracket markup scanner and structural validator.
 */
@SpringBootApplication
public class BracketScanApplication {

	public static void main(String[] args) {
		SpringApplication.run(BracketScanApplication.class, args);
	}

}
