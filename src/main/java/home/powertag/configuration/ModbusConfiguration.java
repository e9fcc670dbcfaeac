package home.powertag.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ModbusConfiguration {
    @Value("${modbus.connectTimeout}")
    private Integer connectTimeout;

    /* таймаут ответа на один запрос - он же основной признак отсутствия устройства, держим коротким */
    @Value("${modbus.readTimeout}")
    private Integer readTimeout;

    @Value("${modbus.validationTimeout}")
    private Integer validationTimeout;

    public Integer getConnectTimeout() {
        return connectTimeout;
    }

    public Integer getReadTimeout() {
        return readTimeout;
    }

    public Integer getValidationTimeout() {
        return validationTimeout;
    }
}
