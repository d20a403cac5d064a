package boxless.email.app;

import boxless.email.app.config.SyncProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;


@EnableScheduling
@EnableConfigurationProperties(SyncProperties.class)
@SpringBootApplication
public class BoxlessApplication {

    public static void main(String[] args) {
        SpringApplication.run(BoxlessApplication.class, args);
    }

}
