package com.yerin.retrydlq.infra;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

public final class WorkerId {
    private static final String HOST = resolveHost();

    private WorkerId() {}

    /** host-xxxxxxxx-{index}. 같은 큐의 워커끼리 구분된다. */
    public static String next(int index) {
        String shortId = UUID.randomUUID().toString().substring(0, 8);
        return HOST + "-" + shortId + "-" + index;
    }

    private static String resolveHost() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "worker";
        }
    }
}
