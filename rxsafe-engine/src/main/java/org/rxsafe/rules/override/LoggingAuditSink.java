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

import org.rxsafe.rules.om.OverrideRecord;
import org.rxsafe.rules.util.Logger;

/**
 * Default sink. Logs scope ids, the alert and the decision; the reason text
 * is not logged since it may contain patient details.
 */
final class LoggingAuditSink implements OverrideAuditSink {

	static final LoggingAuditSink INSTANCE = new LoggingAuditSink();

	private LoggingAuditSink() {
	}

	@Override
	public void accept(OverrideTransaction tx, OverrideRecord record) {
		Logger.info("Override #{} prescription={} visit={} clinician={} {} {} {} rules={}", record.getSequence(),
				tx.getPrescriptionId(), tx.getVisitId(), record.getClinicianId(), record.getDecision(),
				record.getSeverity().label(), record.getAlertKey(), record.getRuleIds());
	}
}
