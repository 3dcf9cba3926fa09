/*
 * Where: Notification service layer
 * What: Resolves the identity written to locked_by when this process claims work
 * Why: Terminal updates are only applied by the worker that still owns the row
 */
package com.salesos.notification.service;

import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class WorkerIdentity {

    private static final Logger logger = LoggerFactory.getLogger(WorkerIdentity.class);
    private static final String HOSTNAME_ENV = "HOSTNAME";
    private static final String DEFAULT_HOSTNAME = "unknown-host";

    private final String id;

    public WorkerIdentity() {
        this(resolveHostname() + ":" + ProcessHandle.current().pid());
    }

    @VisibleForTesting
    public WorkerIdentity(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    // pid suffix keeps two processes on one host apart
    private static String resolveHostname() {
        String env = System.getenv(HOSTNAME_ENV);
        if (env != null && !env.isBlank()) {
            return env;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException | SecurityException ex) {
            logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
            return DEFAULT_HOSTNAME;
        }
    }
}
