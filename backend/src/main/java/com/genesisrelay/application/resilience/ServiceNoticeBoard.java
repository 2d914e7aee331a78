/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.application.resilience;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the most recent user-facing degraded-service notices. Newest first.
 */
@Component
public class ServiceNoticeBoard {
    static final int CAPACITY = 50;

    private final Clock clock;
    private final Deque<ServiceNotice> notices = new ArrayDeque<>();

    public ServiceNoticeBoard(Clock clock) {
        this.clock = clock;
    }

    public ServiceNotice post(String service, String message) {
        ServiceNotice notice = new ServiceNotice(service, message, clock.instant());
        synchronized (notices) {
            notices.addFirst(notice);
            while (notices.size() > CAPACITY) {
                notices.removeLast();
            }
        }
        return notice;
    }

    public List<ServiceNotice> recent() {
        synchronized (notices) {
            return List.copyOf(new ArrayList<>(notices));
        }
    }

    public void clear() {
        synchronized (notices) {
            notices.clear();
        }
    }
}
