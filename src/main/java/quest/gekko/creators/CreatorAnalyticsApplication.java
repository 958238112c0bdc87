package quest.gekko.creators;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CreatorAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(CreatorAnalyticsApplication.class, args);
    }

}
