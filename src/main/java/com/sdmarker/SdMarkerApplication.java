package com.sdmarker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SD Marker Engine - Spiral Dynamics marker scoring and drift detection for chat transcripts.
 */
@SpringBootApplication
public class SdMarkerApplication {

	public static void main(String[] args) {
		SpringApplication.run(SdMarkerApplication.class, args);
	}

}
