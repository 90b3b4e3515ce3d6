package org.iceforge.freeagent.demo;

import org.iceforge.freeagent.client.FreeAgentClientConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@Import(FreeAgentClientConfig.class)
public class FreeAgentDemoApplication {

	public static void main(String[] args) {
		SpringApplication.run(FreeAgentDemoApplication.class, args);
	}
}
