package com.idp.assessment;

import com.idp.assessment.config.AssessmentProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AssessmentProperties.class)
public class GranularAssessmentApplication {

	public static void main(String[] args) {
		SpringApplication.run(GranularAssessmentApplication.class, args);
	}

}
