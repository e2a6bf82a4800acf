package net.layerline.integration.spring.sched;

import net.layerline.core.maintenance.MaintenanceService;
import net.layerline.core.notify.StoreChangeRelay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

public class LayerlineSchedulers {
    private static final Logger log = LoggerFactory.getLogger(LayerlineSchedulers.class);

    private final MaintenanceService maintenance;
    private final StoreChangeRelay relay;

    private boolean maintenanceEnabled = true;
    private Duration pendingGrace = Duration.ofMinutes(2);
    private Duration stalledAfter = Duration.ofMinutes(45);

    /** @param relay 다중 프로세스가 아니면 null */
    public LayerlineSchedulers(MaintenanceService maintenance, StoreChangeRelay relay) {
        this.maintenance = maintenance;
        this.relay = relay;
    }

    @Scheduled(fixedDelayString = "${layerline.maintenance.delay-ms:30000}",
               initialDelayString = "${layerline.maintenance.initial-delay-ms:10000}")
    public void maintenance() throws Exception {
        if (!maintenanceEnabled) return;
        maintenance.runOnce(pendingGrace, stalledAfter);
    }

    @Scheduled(fixedDelayString = "${layerline.relay.delay-ms:1000}")
    public void relay() throws Exception {
        if (relay == null) return;
        int n = relay.pollOnce();
        if (n > 0) log.trace("relayed {} job changes", n);
    }

    public void setMaintenanceEnabled(boolean maintenanceEnabled) {
        this.maintenanceEnabled = maintenanceEnabled;
    }

    public void setPendingGrace(Duration pendingGrace) {
        this.pendingGrace = pendingGrace;
    }

    public void setStalledAfter(Duration stalledAfter) {
        this.stalledAfter = stalledAfter;
    }
}
