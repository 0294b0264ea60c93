package com.example.synthesiseval;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point.
 * Wires the scoring engine, the bundled field registries and the HTTP endpoints under the interfaces layer.
 */
@SpringBootApplication
public class SynthesisEvalApplication {

	public static void main(String[] args) {
		SpringApplication.run(SynthesisEvalApplication.class, args);
	}

}
