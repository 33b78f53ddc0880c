package org.rxsafe.rules.om;

/*
 * This file is part of RxSafe.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * RxSafe is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * RxSafe is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with RxSafe.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import lombok.Builder;
import lombok.Value;

/**
 * Ordered alerts of one check plus how the drug names resolved.
 */
@Value
@Builder
public class CheckResult {

	public enum Status {
		/** All evaluators ran. */
		COMPLETE,
		/** The check did not finish in time; proceed with manual review. */
		ALERTS_UNAVAILABLE
	}

	Status status;

	@Builder.Default
	List<Alert> alerts = List.of();

	@Builder.Default
	List<NormalizedDrug> newDrugs = List.of();

	@Builder.Default
	List<NormalizedDrug> currentDrugs = List.of();

	Duration elapsed;

	public static CheckResult unavailable(Duration elapsed) {
		return CheckResult.builder().status(Status.ALERTS_UNAVAILABLE).elapsed(elapsed).build();
	}

	public boolean isComplete() {
		return status == Status.COMPLETE;
	}

	public List<Alert> getBlockingAlerts() {
		return alerts.stream().filter(Alert::isBlocking).collect(Collectors.toList());
	}

	/** Alerts other than informational coverage-gap notices. */
	public List<Alert> getHardAlerts() {
		return alerts.stream().filter(a -> !a.isInformational()).collect(Collectors.toList());
	}

	public List<Alert> getAlerts(AlertKind kind) {
		return alerts.stream().filter(a -> a.getKind() == kind).collect(Collectors.toList());
	}
}
