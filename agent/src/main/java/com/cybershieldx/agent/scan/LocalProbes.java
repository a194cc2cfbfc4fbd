package com.cybershieldx.agent.scan;

import com.cybershieldx.agent.util.Jsons;
import com.cybershieldx.agent.util.Platforms;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.NetworkInterface;
import java.net.Socket;
import java.net.SocketException;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Built-in probes: host information and a loopback check of common ports.
 * Probes that need a dedicated engine report themselves as unsupported.
 */
public class LocalProbes implements ScanCollaborator {
    private static final Logger log = LoggerFactory.getLogger(LocalProbes.class);

    static final List<Integer> COMMON_PORTS = List.of(
            21, 22, 23, 25, 53, 80, 110, 135, 139, 143, 443, 445, 3306, 3389, 5432, 5900, 8080);
    static final List<Integer> EXTENDED_PORTS = List.of(
            1433, 1521, 2049, 2375, 5000, 5601, 6379, 8000, 8443, 9000, 9200, 11211, 27017);

    private static final int CONNECT_TIMEOUT_MILLIS = 200;

    private final Executor executor;

    public LocalProbes(Executor executor) {
        this.executor = executor;
    }

    @Override
    public CompletableFuture<ScanResult> probe(Probe probe, ScanDepth depth) {
        switch (probe) {
            case SYSTEM_INFO:
                return CompletableFuture.supplyAsync(() -> ScanResult.ok(systemInfo(depth)), executor);
            case COMMON_PORTS:
                return CompletableFuture.supplyAsync(() -> ScanResult.ok(commonPorts(depth)), executor);
            default:
                ObjectNode unsupported = Jsons.object();
                unsupported.put("supported", false);
                unsupported.put("probe", probe.name());
                return CompletableFuture.completedFuture(ScanResult.ok(unsupported));
        }
    }

    ObjectNode systemInfo(ScanDepth depth) {
        Runtime runtime = Runtime.getRuntime();
        ObjectNode info = Jsons.object();
        info.put("hostname", Platforms.hostname());
        info.put("platform", Platforms.platform());
        info.put("arch", Platforms.arch());
        info.put("osName", System.getProperty("os.name"));
        info.put("osVersion", System.getProperty("os.version"));
        info.put("cpus", runtime.availableProcessors());
        info.put("maxMemory", runtime.maxMemory());
        info.put("freeMemory", runtime.freeMemory());
        info.put("uptimeSeconds", ManagementFactory.getRuntimeMXBean().getUptime() / 1000);
        if (depth != ScanDepth.BASIC) {
            info.set("interfaces", interfaces());
        }
        return info;
    }

    private ArrayNode interfaces() {
        ArrayNode list = Jsons.mapper().createArrayNode();
        try {
            for (NetworkInterface nic : Collections.list(NetworkInterface.getNetworkInterfaces())) {
                if (nic.isLoopback() || !nic.isUp()) {
                    continue;
                }
                ObjectNode entry = list.addObject();
                entry.put("name", nic.getName());
                byte[] mac = nic.getHardwareAddress();
                if (mac != null) {
                    StringBuilder sb = new StringBuilder();
                    for (byte b : mac) {
                        if (sb.length() > 0) {
                            sb.append(':');
                        }
                        sb.append(String.format("%02x", b));
                    }
                    entry.put("mac", sb.toString());
                }
                ArrayNode addresses = entry.putArray("addresses");
                for (InetAddress address : Collections.list(nic.getInetAddresses())) {
                    addresses.add(address.getHostAddress());
                }
            }
        } catch (SocketException e) {
            log.warn("Could not list network interfaces: {}", e.getMessage());
        }
        return list;
    }

    ObjectNode commonPorts(ScanDepth depth) {
        ObjectNode result = Jsons.object();
        ArrayNode open = result.putArray("open");
        scanPorts(COMMON_PORTS, open);
        if (depth == ScanDepth.MAXIMUM) {
            scanPorts(EXTENDED_PORTS, open);
        }
        result.put("host", "127.0.0.1");
        return result;
    }

    private static void scanPorts(List<Integer> ports, ArrayNode open) {
        for (int port : ports) {
            try (Socket socket = new Socket()) {
                socket.connect(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), CONNECT_TIMEOUT_MILLIS);
                open.add(port);
            } catch (IOException e) {
                log.trace("Port {} closed or filtered: {}", port, e.getMessage());
            }
        }
    }
}
