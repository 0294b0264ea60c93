package com.example.synthesiseval;

import com.example.synthesiseval.application.service.FieldRegistryCatalog;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration smoke test: the context boots and the bundled registries load from the classpath.
 */
@SpringBootTest
class SynthesisEvalApplicationTests {

	@Autowired
	private FieldRegistryCatalog registryCatalog;

	@Test
	void contextLoads() {
		assertThat(registryCatalog.names()).contains("characterisation", "chemicals", "cbu");
	}

}
