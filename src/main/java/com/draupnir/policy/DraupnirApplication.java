package com.draupnir.policy;

import com.draupnir.policy.cli.CommandLineInterface;
import lombok.extern.slf4j.Slf4j;

/**
 * Main application entry point for Draupnir
 * Cilium network policy validation and zero-trust posture tool
 */
@Slf4j
public class DraupnirApplication {

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new CommandLineInterface().execute(args);
        } catch (Exception e) {
            log.error("Error executing Draupnir", e);
            System.err.println("\n❌ Error: " + e.getMessage());
            exitCode = 1;
        }
        System.exit(exitCode);
    }
}
