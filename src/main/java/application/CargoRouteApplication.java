package application;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = {"application", "common", "controller", "engine", "model", "service"})
@ConfigurationPropertiesScan(basePackages = "common.config")
public class CargoRouteApplication {
    public static void main(String[] args) {
        SpringApplication.run(CargoRouteApplication.class, args);
    }
}
