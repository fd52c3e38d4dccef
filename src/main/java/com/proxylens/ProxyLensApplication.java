package com.proxylens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for ProxyLens.
 *
 * ProxyLens turns uploaded web-proxy logs into analyst-facing SOC reports:
 * - Background ingestion of JSON, CEF and key=value proxy logs
 * - Per-minute rollups and upload features
 * - Deterministic detection rules producing evidence-backed findings
 * - Incident synthesis with a reasoning-service narrative and a template fallback
 */
@SpringBootApplication
public class ProxyLensApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProxyLensApplication.class, args);
    }
}
