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

import java.time.Instant;
import java.util.*;

import org.rxsafe.rules.om.Alert;
import org.rxsafe.rules.om.AlertKey;
import org.rxsafe.rules.om.OverrideDecision;
import org.rxsafe.rules.om.OverrideRecord;

/**
 * Override state for one prescription check-and-save cycle.
 * <p>
 * Holds the alerts the clinician was shown and the decisions recorded against
 * them. Appends are serialized on the transaction; two transactions never
 * share state. The save path calls {@link #requireClearedToSave()} before
 * persisting the prescription.
 */
public final class OverrideTransaction {

	private final String patientId;
	private final String visitId;
	private final String prescriptionId;
	private final String clinicianId;
	private final List<Alert> alerts;
	private final Map<AlertKey, Alert> alertsByKey;

	// guarded by this
	private final List<OverrideRecord> records = new ArrayList<>();
	private final Map<AlertKey, OverrideRecord> latest = new HashMap<>();

	OverrideTransaction(String patientId, String visitId, String prescriptionId, String clinicianId,
			List<Alert> alerts) {
		this.patientId = patientId;
		this.visitId = visitId;
		this.prescriptionId = prescriptionId;
		this.clinicianId = clinicianId;
		this.alerts = List.copyOf(alerts);
		Map<AlertKey, Alert> byKey = new LinkedHashMap<>();
		for (Alert a : alerts) {
			byKey.put(a.getKey(), a);
		}
		this.alertsByKey = Collections.unmodifiableMap(byKey);
	}

	public String getPatientId() {
		return patientId;
	}

	public String getVisitId() {
		return visitId;
	}

	public String getPrescriptionId() {
		return prescriptionId;
	}

	public String getClinicianId() {
		return clinicianId;
	}

	public List<Alert> getAlerts() {
		return alerts;
	}

	public boolean contains(Alert alert) {
		return alert != null && alert.equals(alertsByKey.get(alert.getKey()));
	}

	/** Append-ordered copy of every decision recorded so far. */
	public synchronized List<OverrideRecord> getRecords() {
		return List.copyOf(records);
	}

	public synchronized Optional<OverrideRecord> latestFor(AlertKey key) {
		return Optional.ofNullable(latest.get(key));
	}

	/**
	 * Blocking alerts whose most recent decision is not
	 * {@link OverrideDecision#PROCEEDED}, in alert order.
	 */
	public synchronized List<Alert> pendingBlockingAlerts() {
		List<Alert> pending = new ArrayList<>();
		for (Alert a : alerts) {
			if (!a.isBlocking()) {
				continue;
			}
			OverrideRecord r = latest.get(a.getKey());
			if (r == null || r.getDecision() != OverrideDecision.PROCEEDED) {
				pending.add(a);
			}
		}
		return pending;
	}

	/** True when the prescription may be saved. */
	public boolean isClearedToSave() {
		return pendingBlockingAlerts().isEmpty();
	}

	/**
	 * @throws IllegalStateException when a blocking alert has no proceeded
	 *                               decision
	 */
	public void requireClearedToSave() {
		List<Alert> pending = pendingBlockingAlerts();
		if (!pending.isEmpty()) {
			List<AlertKey> keys = new ArrayList<>();
			for (Alert a : pending) {
				keys.add(a.getKey());
			}
			throw new IllegalStateException(
					"Prescription " + prescriptionId + " has " + pending.size() + " unresolved blocking alert(s): " + keys);
		}
	}

	/**
	 * Build the next record, hand it to the sink and append it, all under the
	 * transaction lock so the sink sees records in sequence order. A sink
	 * failure leaves the transaction unchanged.
	 */
	synchronized OverrideRecord append(Alert alert, OverrideDecision decision, String reason, Instant timestamp,
			OverrideAuditSink sink) {
		OverrideRecord rec = OverrideRecord.builder().sequence(records.size() + 1L).alertKey(alert.getKey())
				.severity(alert.getSeverity()).decision(decision).reason(reason).clinicianId(clinicianId)
				.timestamp(timestamp).ruleIds(alert.getDetails().getRuleIds()).build();
		sink.accept(this, rec);
		records.add(rec);
		latest.put(rec.getAlertKey(), rec);
		return rec;
	}

	@Override
	public String toString() {
		return "OverrideTransaction[prescription=" + prescriptionId + ", alerts=" + alerts.size() + "]";
	}
}
