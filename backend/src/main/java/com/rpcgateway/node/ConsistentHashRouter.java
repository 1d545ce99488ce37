package com.rpcgateway.node;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Consistent-hash router over a per-group node list. The same key keeps hitting the same node while the
 * group's membership is stable; adding or removing a node only remaps the keys of its ring segments.
 * <p>
 * Each group's ring is immutable and swapped atomically on change, so {@link #route} never locks.
 */
@Slf4j
public class ConsistentHashRouter implements Router {

    public static final int DEFAULT_VIRTUAL_NODES = 160;

    private final int virtualNodes;
    private final ConcurrentMap<Group, HashRing> rings = new ConcurrentHashMap<>();

    public ConsistentHashRouter() {
        this(DEFAULT_VIRTUAL_NODES);
    }

    /**
     * @param virtualNodes ring points per node; rounded up to a multiple of 4
     */
    public ConsistentHashRouter(int virtualNodes) {
        if (virtualNodes <= 0) {
            throw new IllegalArgumentException("virtualNodes must be positive");
        }
        this.virtualNodes = virtualNodes;
    }

    /**
     * Router with initial membership, e.g. from configuration.
     */
    public static ConsistentHashRouter of(Map<Group, ? extends Collection<String>> nodesByGroup, int virtualNodes) {
        ConsistentHashRouter router = new ConsistentHashRouter(virtualNodes);
        nodesByGroup.forEach(router::setNodes);
        return router;
    }

    @Override
    public Optional<String> route(Group group, byte[] key) {
        HashRing ring = rings.get(group);
        if (ring == null) {
            return Optional.empty();
        }
        return Optional.of(ring.select(key));
    }

    /**
     * Replaces the group's membership. An empty collection removes the group from routing.
     */
    public void setNodes(Group group, Collection<String> urls) {
        rings.compute(group, (g, old) -> build(g, urls));
    }

    public void addNode(Group group, String url) {
        rings.compute(group, (g, old) -> {
            List<String> urls = old == null ? new ArrayList<>() : new ArrayList<>(old.urls());
            urls.add(url);
            return build(g, urls);
        });
    }

    public void removeNode(Group group, String url) {
        rings.computeIfPresent(group, (g, old) -> {
            List<String> urls = new ArrayList<>(old.urls());
            urls.remove(url);
            return build(g, urls);
        });
    }

    public List<String> nodes(Group group) {
        HashRing ring = rings.get(group);
        return ring == null ? List.of() : ring.urls();
    }

    private HashRing build(Group group, Collection<String> urls) {
        List<String> distinct = urls == null ? List.of() : urls.stream()
                .filter(u -> u != null && !u.isBlank())
                .collect(LinkedHashSet<String>::new, LinkedHashSet::add, LinkedHashSet::addAll)
                .stream().toList();
        if (distinct.isEmpty()) {
            log.info("No full node left in group {}", group);
            return null;
        }
        log.info("Routing group {} over {} node(s)", group, distinct.size());
        return new HashRing(distinct, virtualNodes);
    }

    private static final class HashRing {

        private final TreeMap<Long, String> ring = new TreeMap<>();
        private final List<String> urls;

        HashRing(List<String> urls, int virtualNodes) {
            this.urls = List.copyOf(urls);
            int replicas = Math.max(1, (virtualNodes + 3) / 4);
            for (String url : this.urls) {
                for (int i = 0; i < replicas; i++) {
                    byte[] digest = md5((url + "#" + i).getBytes(StandardCharsets.UTF_8));
                    for (int h = 0; h < 4; h++) {
                        ring.put(hash(digest, h), url);
                    }
                }
            }
        }

        String select(byte[] key) {
            long hash = hash(md5(key == null ? new byte[0] : key), 0);
            Map.Entry<Long, String> entry = ring.ceilingEntry(hash);
            return entry != null ? entry.getValue() : ring.firstEntry().getValue();
        }

        List<String> urls() {
            return urls;
        }

        private static long hash(byte[] digest, int number) {
            return (((long) (digest[3 + number * 4] & 0xFF) << 24)
                    | ((long) (digest[2 + number * 4] & 0xFF) << 16)
                    | ((long) (digest[1 + number * 4] & 0xFF) << 8)
                    | (digest[number * 4] & 0xFF))
                    & 0xFFFFFFFFL;
        }

        private static byte[] md5(byte[] value) {
            try {
                return MessageDigest.getInstance("MD5").digest(value);
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("MD5 not available", e);
            }
        }
    }
}
