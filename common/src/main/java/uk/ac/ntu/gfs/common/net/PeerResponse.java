package uk.ac.ntu.gfs.common.net;

import uk.ac.ntu.gfs.common.error.ErrorKind;
import uk.ac.ntu.gfs.common.error.GfsException;

import java.nio.charset.StandardCharsets;

public record PeerResponse(int status, byte[] body) {

    public boolean ok() {
        return status == 200;
    }

    public String text() {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8).trim();
    }

    public PeerResponse orThrow() throws GfsException {
        if (ok()) return this;
        throw new GfsException(ErrorKind.fromStatus(status), "status " + status + " " + text());
    }
}
