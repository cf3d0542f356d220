package com.flagship.savings_circle.cycle;

import java.util.UUID;

public class ContributionNotFoundException extends RuntimeException {

    public ContributionNotFoundException(UUID contributionId) {
        super("Contribution not found: " + contributionId);
    }
}
