package org.rxsafe.rules.override;

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

import java.time.Clock;
import java.util.List;
import java.util.Objects;

import org.apache.commons.lang3.StringUtils;
import org.rxsafe.rules.om.Alert;
import org.rxsafe.rules.om.OverrideDecision;
import org.rxsafe.rules.om.OverrideRecord;
import org.rxsafe.rules.util.Logger;

/**
 * Validates and records clinician decisions on alerts.
 * <p>
 * Gating rules:
 * <ul>
 * <li>proceeding past an alert that requires a reason needs a non-blank
 * reason ({@link MissingReasonException})</li>
 * <li>an alert from an absolute rule cannot be proceeded past at all
 * ({@link BlockedDecisionException})</li>
 * <li>cancelling is always accepted, with or without a reason</li>
 * </ul>
 * Accepted decisions become immutable {@link OverrideRecord}s, appended to the
 * transaction and passed to the audit sink.
 */
public final class OverrideLedger {

	private final OverrideAuditSink sink;
	private final Clock clock;

	public OverrideLedger() {
		this(OverrideAuditSink.logging(), Clock.systemUTC());
	}

	public OverrideLedger(OverrideAuditSink sink, Clock clock) {
		this.sink = Objects.requireNonNull(sink, "sink");
		this.clock = Objects.requireNonNull(clock, "clock");
	}

	/**
	 * Start a transaction for the alerts of one check.
	 */
	public OverrideTransaction open(String patientId, String visitId, String prescriptionId, String clinicianId,
			List<Alert> alerts) {
		return new OverrideTransaction(patientId, visitId, prescriptionId, clinicianId, alerts);
	}

	/**
	 * Record a decision.
	 *
	 * @throws MissingReasonException   proceeding without a required reason
	 * @throws BlockedDecisionException proceeding past a non-overridable alert
	 * @throws IllegalArgumentException the alert was not part of this
	 *                                  transaction's check
	 */
	public OverrideRecord record(OverrideTransaction tx, Alert alert, OverrideDecision decision, String reason)
			throws OverrideRejectedException {
		Objects.requireNonNull(tx, "tx");
		Objects.requireNonNull(decision, "decision");
		if (!tx.contains(alert)) {
			throw new IllegalArgumentException("Alert " + (alert == null ? null : alert.getKey())
					+ " does not belong to " + tx);
		}

		if (decision == OverrideDecision.PROCEEDED) {
			if (!alert.isCanOverride()) {
				Logger.warn("Rejected override of absolute alert {} rules={}", alert.getKey(),
						alert.getDetails().getRuleIds());
				throw new BlockedDecisionException(alert);
			}
			if (alert.isOverrideRequiresReason() && StringUtils.isBlank(reason)) {
				Logger.warn("Rejected override of {} without a reason, rules={}", alert.getKey(),
						alert.getDetails().getRuleIds());
				throw new MissingReasonException(alert);
			}
		}

		String text = StringUtils.trimToEmpty(reason);
		return tx.append(alert, decision, text, clock.instant(), sink);
	}
}
