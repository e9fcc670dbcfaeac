package home.powertag.configuration;

import home.powertag.model.PairedDevice;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@ConfigurationProperties("powertag")
public class PairedDevicesConfiguration {
    private final List<PairedDevice> devices = new ArrayList<>();

    public List<PairedDevice> getDevices() {
        return devices;
    }

    public Optional<PairedDevice> getDevice(String deviceId) {
        return devices.stream().filter(device -> device.getDeviceId().equals(deviceId)).findFirst();
    }
}
