package com.lynkvertx.gridpilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * GridPilot - cost and carbon aware appliance autopilot
 * Main application entry point
 */
@SpringBootApplication
public class GridPilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(GridPilotApplication.class, args);
    }
}
