/*
 * Copyright (C) 2025 Genesis Relay
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.genesisrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GenesisRelayApplication {
    public static void main(String[] args) {
        SpringApplication.run(GenesisRelayApplication.class, args);
    }
}
