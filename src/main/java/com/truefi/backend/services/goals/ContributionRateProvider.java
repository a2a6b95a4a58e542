package com.truefi.backend.services.goals;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import com.truefi.backend.entities.Goal;

/** Recent monthly pace at which money flows into a goal. Empty when there is no basis to tell. */
public interface ContributionRateProvider {

    Optional<BigDecimal> observedMonthlyContribution(Goal goal, LocalDate today);
}
