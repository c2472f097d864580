package io.atom.governor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * GOVERNOR - maturity-gated trigger governance for agents.
 *
 * <p>GOVERNOR provides:
 * <ul>
 *   <li>Confidence and maturity ledger - confidence scoring, audited promotion and demotion, action gating</li>
 *   <li>Agent context resolution - explicit agent, session agent or the system default agent</li>
 *   <li>Trigger interception - training, proposal, supervision or direct execution per maturity level</li>
 *   <li>Proposal review and supervision completion feeding confidence back into the ledger</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties
public class GovernorApplication {

    public static void main(String[] args) {
        SpringApplication.run(GovernorApplication.class, args);
    }
}
