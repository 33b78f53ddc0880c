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

import java.time.Instant;
import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Append-only audit entry for one clinician decision on one alert.
 */
@Value
@Builder
public class OverrideRecord {

	/** Position in the owning transaction, starting at 1. */
	long sequence;

	AlertKey alertKey;
	Severity severity;
	OverrideDecision decision;

	/** Clinician-supplied reason; empty when none was given. */
	String reason;

	String clinicianId;
	Instant timestamp;

	/** Rule ids behind the alert, for reconstructing the decision. */
	List<String> ruleIds;

	public AlertKind getAlertKind() {
		return alertKey.getKind();
	}
}
