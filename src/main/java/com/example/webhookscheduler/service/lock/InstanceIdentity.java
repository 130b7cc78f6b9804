package com.example.webhookscheduler.service.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * Identifies this scheduler process as lock owner and worker id.
 */
@Slf4j
@Component
public class InstanceIdentity {

    private final String instanceId;

    public InstanceIdentity(@Value("${HOSTNAME:unknown}") String hostname) {
        this.instanceId = resolve(hostname);
        log.info("Scheduler instance id: {}", instanceId);
    }

    public String getInstanceId() {
        return instanceId;
    }

    private static String resolve(String hostname) {
        try {
            var host = InetAddress.getLocalHost().getHostName();
            return host + "-" + ProcessHandle.current().pid();
        } catch (UnknownHostException e) {
            return hostname + "-" + UUID.randomUUID().toString().substring(0, 8);
        }
    }
}
