package com.lendingengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Lending Engine.
 *
 * Lending Engine is a collateralized lending ledger: lenders supply a base asset
 * to a shared pool, borrowers lock collateral and draw against it, interest and
 * fees accrue on a quarterly schedule, and overdue or undercollateralized
 * positions can be liquidated by any third party.
 */
@SpringBootApplication
public class LendingEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(LendingEngineApplication.class, args);
    }
}
