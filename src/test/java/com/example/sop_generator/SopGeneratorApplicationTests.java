package com.example.sop_generator;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class SopGeneratorApplicationTests {

	@Test
	void contextLoads() {
	}

}
