package uk.ac.ntu.gfs.common.http;

import com.sun.net.httpserver.HttpExchange;
import uk.ac.ntu.gfs.common.error.GfsException;

import java.io.IOException;

@FunctionalInterface
public interface GfsHandler {
    void handle(HttpExchange ex) throws GfsException, IOException;
}
