package uk.ac.ntu.gfs.master.core;

import java.util.List;

public interface PlacementPolicy {
    String name();

    List<String> select(List<String> registered, int replicas);
}
