package com.example.inpainting;

import com.example.inpainting.config.InpaintingProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest
class InpaintingApplicationTests {

	@Autowired
	private InpaintingProperties properties;

	@Test
	void contextLoadsWithDefaults() {
		assertEquals(1000, properties.maxIterations());
		assertEquals(1e-4, properties.tolerance(), 0.0);
		assertEquals(30.0, properties.damagePercent(), 0.0);
		assertEquals(15, properties.brushSize());
	}

}
