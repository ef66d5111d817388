package com.mediapipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MediaPipelineApplication {

	public static void main(String[] args) {
		SpringApplication.run(MediaPipelineApplication.class, args);
	}

}
