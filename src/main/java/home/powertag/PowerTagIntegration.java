package home.powertag;

import home.powertag.configuration.PairedDevicesConfiguration;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableCaching
@EnableScheduling
@EnableConfigurationProperties(PairedDevicesConfiguration.class)
public class PowerTagIntegration {
    public static void main(String[] args) {
        SpringApplication.run(PowerTagIntegration.class, args);
    }
}
