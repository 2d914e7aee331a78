/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay.api.notices;

import com.genesisrelay.application.resilience.ServiceNotice;
import com.genesisrelay.application.resilience.ServiceNoticeBoard;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/notices")
public class NoticeController {
    private final ServiceNoticeBoard board;

    public NoticeController(ServiceNoticeBoard board) {
        this.board = board;
    }

    @GetMapping
    public List<ServiceNotice> recent() {
        return board.recent();
    }
}
