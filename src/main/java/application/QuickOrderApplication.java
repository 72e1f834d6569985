package application;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = {"application", "common", "controller", "model", "service"})
@ConfigurationPropertiesScan(basePackages = "common.config")
public class QuickOrderApplication {
    public static void main(String[] args) {
        SpringApplication.run(QuickOrderApplication.class, args);
    }
}
