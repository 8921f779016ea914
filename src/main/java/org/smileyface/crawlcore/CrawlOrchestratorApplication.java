package org.smileyface.crawlcore;

import org.smileyface.crawlcore.cli.OrchestratorCommandLine;
import org.smileyface.crawlcore.config.OrchestratorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@EnableConfigurationProperties(OrchestratorProperties.class)
@EnableScheduling
public class CrawlOrchestratorApplication {

	public static void main(String[] args) {
		SpringApplication app = new SpringApplication(CrawlOrchestratorApplication.class);
		if (OrchestratorCommandLine.isCommand(args)) {
			app.setWebApplicationType(WebApplicationType.NONE);
			System.exit(SpringApplication.exit(app.run(args)));
		}
		app.run(args);
	}
}
