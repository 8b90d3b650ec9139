package com.sandy.agentops.alerting;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AgentOpsAlertingApplication {

	public static void main(String[] args) {
		SpringApplication.run(AgentOpsAlertingApplication.class, args);
	}

}
