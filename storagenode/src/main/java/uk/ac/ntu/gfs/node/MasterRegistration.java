package uk.ac.ntu.gfs.node;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.ac.ntu.gfs.common.error.GfsException;
import uk.ac.ntu.gfs.common.net.PeerClient;
import uk.ac.ntu.gfs.common.protocol.Protocol;

import java.time.Duration;

public final class MasterRegistration {
    private static final Logger log = LoggerFactory.getLogger(MasterRegistration.class);

    private final PeerClient peers;
    private final String masterAddress;
    private final int attempts;
    private final Duration delay;

    public MasterRegistration(PeerClient peers, String masterAddress, int attempts, Duration delay) {
        this.peers = peers;
        this.masterAddress = masterAddress;
        this.attempts = attempts;
        this.delay = delay;
    }

    public boolean register(String selfAddress) {
        String url = PeerClient.url(masterAddress, Protocol.REGISTER, Protocol.PARAM_SERVER, selfAddress);
        for (int i = 1; i <= attempts; i++) {
            try {
                peers.post(url).orThrow();
                log.info("Registered with master at {}", masterAddress);
                return true;
            } catch (GfsException e) {
                log.warn("Failed to register with master (attempt {}): {}", i, e.getMessage());
            }
            if (i < attempts && !sleep()) return false;
        }
        log.warn("Giving up on registration with {}; serving unregistered", masterAddress);
        return false;
    }

    private boolean sleep() {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
