package com.khoipd8.teacherdashboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TeacherDashboardApplication {

	public static void main(String[] args) {
		SpringApplication.run(TeacherDashboardApplication.class, args);
	}

}
