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

import java.util.Collections;
import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Drug-or-class contraindicated in a condition. Qualified rules (renal,
 * pregnancy, geriatric) also fire from the patient's labs and demographics.
 */
@Value
public class ContraindicationRule {

	String ruleId;
	String subject;
	String condition;
	Severity severity;
	String reason;
	List<String> alternatives;
	RuleQualifier qualifier;

	/** eGFR cutoff (RENAL) or minimum age (GERIATRIC); null otherwise. */
	Double threshold;

	boolean absolute;

	@Builder
	public ContraindicationRule(String ruleId, String subject, String condition, Severity severity, String reason,
			List<String> alternatives, RuleQualifier qualifier, Double threshold, boolean absolute) {
		this.ruleId = ruleId;
		this.subject = subject;
		this.condition = condition;
		this.severity = severity;
		this.reason = reason == null ? "" : reason;
		this.alternatives = alternatives == null ? Collections.emptyList() : List.copyOf(alternatives);
		this.qualifier = qualifier == null ? RuleQualifier.NONE : qualifier;
		this.threshold = threshold;
		this.absolute = absolute;
	}

	public boolean isQualified() {
		return qualifier != RuleQualifier.NONE;
	}
}
