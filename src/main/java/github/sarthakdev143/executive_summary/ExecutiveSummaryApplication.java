package github.sarthakdev143.executive_summary;

import github.sarthakdev143.executive_summary.config.ExecutiveSummaryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ExecutiveSummaryProperties.class)
public class ExecutiveSummaryApplication {

	public static void main(String[] args) {
		SpringApplication.run(ExecutiveSummaryApplication.class, args);
	}

}
