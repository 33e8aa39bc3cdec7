package com.sensorwatch.core.system;

import com.sensorwatch.core.alert.AlertManager;
import com.sensorwatch.core.config.MonitoringConfig;
import com.sensorwatch.core.notify.NotificationTransport;
import com.sensorwatch.core.notify.Notifier;
import com.sensorwatch.core.notify.NotifierFactory;
import com.sensorwatch.core.sensor.Sensor;
import com.sensorwatch.core.sensor.SensorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Builds a ready-to-run {@link MonitoringSystem} from a
 * {@link MonitoringConfig}, creating every sensor and notifier through the
 * factories.
 *
 * <p>
 * Construction errors (unknown sensor type, invalid thresholds, duplicate
 * ids) propagate to the caller.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitoringSystemAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(MonitoringSystemAssembler.class);

    private MonitoringSystemAssembler() {
        // utility class — not instantiable
    }

    /**
     * @param name      system name
     * @param version   system version; {@code null} for the default
     * @param config    validated configuration
     * @param transport transport shared by all configured notifiers
     * @return assembled, not yet initialized system
     */
    public static MonitoringSystem assemble(String name, String version, MonitoringConfig config,
            NotificationTransport transport) {
        Objects.requireNonNull(config, "MonitoringConfig must not be null");
        Objects.requireNonNull(transport, "NotificationTransport must not be null");

        AlertManager manager = new AlertManager(config);
        for (Sensor sensor : SensorFactory.createAll(config.getSensors())) {
            manager.addSensor(sensor);
        }
        for (Notifier notifier : NotifierFactory.createAll(config.getNotifiers(), transport)) {
            manager.addNotifier(notifier);
        }

        LOG.info("Assembled system {} from {}", name, config);
        return new MonitoringSystem(name, version, manager);
    }
}
