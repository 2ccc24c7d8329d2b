package uk.ac.ntu.gfs.common.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChunkInfo(
        @JsonProperty("handle") String handle,
        @JsonProperty("servers") List<String> servers,
        @JsonProperty("version") int version,
        @JsonProperty("size") long size,
        @JsonProperty("primary") String primary,
        @JsonProperty("lease_end") Instant leaseEnd) {

    public ChunkInfo {
        servers = servers == null ? List.of() : List.copyOf(servers);
    }
}
