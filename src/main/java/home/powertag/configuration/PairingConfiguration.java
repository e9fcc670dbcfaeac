package home.powertag.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PairingConfiguration {
    /* если адрес не задан - сопряжение при старте не выполняется */
    @Value("${pairing.address:}")
    private String address;

    @Value("${pairing.port:502}")
    private Integer port;

    public String getAddress() {
        return address;
    }

    public Integer getPort() {
        return port;
    }

    public boolean isEnabled() {
        return address != null && !address.isBlank();
    }
}
