package com.whu.cosmicam;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CosmiCamApplication {

	public static void main(String[] args) {
		SpringApplication.run(CosmiCamApplication.class, args);
	}

}
