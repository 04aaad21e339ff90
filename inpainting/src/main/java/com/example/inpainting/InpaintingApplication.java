package com.example.inpainting;

import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.factory.Nd4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class InpaintingApplication {

	public static void main(String[] args) {
		Nd4j.setDefaultDataTypes(DataType.DOUBLE, DataType.DOUBLE);
		SpringApplication.run(InpaintingApplication.class, args);
	}

}
