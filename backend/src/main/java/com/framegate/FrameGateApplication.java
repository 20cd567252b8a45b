package com.framegate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * FrameGate - sprite frame normalization and quality gating service.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class FrameGateApplication {

	public static void main(String[] args) {
		SpringApplication.run(FrameGateApplication.class, args);
	}

}
