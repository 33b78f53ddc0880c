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

import lombok.Builder;
import lombok.Value;

/**
 * Clinical alert produced by one prescription check. Created fresh per call
 * and never persisted; only the override decision about it is.
 */
@Value
@Builder
public class Alert {

	AlertKey key;
	Severity severity;
	String title;
	String message;
	AlertDetails details;

	/** False only when a matched rule is marked absolute. */
	boolean canOverride;

	/** Proceeding requires a documented reason. */
	boolean overrideRequiresReason;

	public AlertKind getKind() {
		return key.getKind();
	}

	/** Coverage-gap notices; never block the save path. */
	public boolean isInformational() {
		return key.getKind() == AlertKind.UNRECOGNIZED;
	}

	/**
	 * The save path must not continue until a PROCEEDED override is recorded for
	 * every blocking alert.
	 */
	public boolean isBlocking() {
		if (isInformational())
			return false;
		return !canOverride || overrideRequiresReason || severity.isAtLeast(Severity.MAJOR);
	}
}
