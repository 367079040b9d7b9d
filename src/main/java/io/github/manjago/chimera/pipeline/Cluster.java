package io.github.manjago.chimera.pipeline;

import io.github.manjago.chimera.scan.MutationSite;

import java.util.List;

/**
 * Sites sharing a cluster key. Only the representative executes; its verdict
 * is reported for every member.
 *
 * @param members all sites of the cluster in scan order, representative included
 */
public record Cluster(String key, List<MutationSite> members, MutationSite representative) {

    public Cluster {
        members = List.copyOf(members);
    }

    public int size() {
        return members.size();
    }
}
