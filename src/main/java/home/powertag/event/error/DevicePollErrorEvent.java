package home.powertag.event.error;

import home.powertag.model.PairedDevice;
import org.springframework.context.ApplicationEvent;

public class DevicePollErrorEvent extends ApplicationEvent {
    private final PairedDevice device;

    private final Exception cause;

    public DevicePollErrorEvent(Object source, PairedDevice device, Exception cause) {
        super(source);
        this.device = device;
        this.cause = cause;
    }

    public PairedDevice getDevice() {
        return device;
    }

    public Exception getCause() {
        return cause;
    }
}
