package com.coherenceai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * CoherenceAi - ethical compliance and coherence fusion engine.
 */
@SpringBootApplication
@EnableScheduling
public class CoherenceAiApplication {

	public static void main(String[] args) {
		SpringApplication.run(CoherenceAiApplication.class, args);
	}

}
