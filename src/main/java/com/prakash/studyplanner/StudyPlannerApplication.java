package com.prakash.studyplanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // Housekeeping only, see SuggestionCleanupOrchestrator
@EnableMongoAuditing // Fills @CreatedDate / @LastModifiedDate on documents
public class StudyPlannerApplication {

	public static void main(String[] args) {
		SpringApplication.run(StudyPlannerApplication.class, args);
	}

}
