package uk.ac.ntu.gfs.master.core;

import java.util.List;

public final class PrefixPlacement implements PlacementPolicy {

    @Override
    public String name() { return "prefix"; }

    @Override
    public List<String> select(List<String> registered, int replicas) {
        if (registered == null || registered.isEmpty() || replicas <= 0) return List.of();
        int n = Math.min(replicas, registered.size());
        return List.copyOf(registered.subList(0, n));
    }
}
