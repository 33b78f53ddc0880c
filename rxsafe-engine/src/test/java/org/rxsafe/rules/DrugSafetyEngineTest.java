package org.rxsafe.rules;

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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.rxsafe.rules.conf.ConfigLoader;
import org.rxsafe.rules.om.Alert;
import org.rxsafe.rules.om.AlertKind;
import org.rxsafe.rules.om.CheckResult;
import org.rxsafe.rules.om.OverrideDecision;
import org.rxsafe.rules.om.PrescriptionCheckRequest;
import org.rxsafe.rules.override.MissingReasonException;
import org.rxsafe.rules.override.OverrideLedger;
import org.rxsafe.rules.override.OverrideTransaction;
import org.rxsafe.rules.reference.DataLoadException;

class DrugSafetyEngineTest {

	@TempDir
	Path tmp;

	// --- helpers -------------------------------------------------------------

	private static Properties baseProps() {
		Properties p = new Properties();
		p.setProperty("CHECK_TIMEOUT_MS", "30000");
		return p;
	}

	private static void write(Path dir, String name, String content) throws Exception {
		Files.write(dir.resolve(name), content.getBytes(StandardCharsets.UTF_8));
	}

	// --- startup -------------------------------------------------------------

	@Test
	void starts_on_bundled_data_and_checks() throws Exception {
		try (DrugSafetyEngine engine = DrugSafetyEngine.start(new ConfigLoader(baseProps()))) {
			assertTrue(engine.getStore().getDrugs().size() > 50);
			assertEquals(4, engine.getPipeline().getEvaluators().size());

			CheckResult r = engine
					.check(PrescriptionCheckRequest.builder().newDrug("warfarin").currentDrug("Brufen 400mg").build());
			assertTrue(r.isComplete());
			assertEquals(1, r.getAlerts(AlertKind.INTERACTION).size());
		}
	}

	@Test
	void starts_from_reference_directory() throws Exception {
		write(tmp, "drug_classes.csv", ReferenceFixtures.DRUGS);
		write(tmp, "interactions.csv", ReferenceFixtures.INTERACTIONS);
		write(tmp, "contraindications.csv", ReferenceFixtures.CONTRAINDICATIONS);
		write(tmp, "cross_allergies.csv", ReferenceFixtures.CROSS_ALLERGIES);
		Properties p = baseProps();
		p.setProperty("REFERENCE_DATA_PATH", tmp.toString());

		try (DrugSafetyEngine engine = DrugSafetyEngine.start(new ConfigLoader(p))) {
			assertEquals(6, engine.getStore().getDrugs().size());
			CheckResult r = engine.check(PrescriptionCheckRequest.builder().newDrug("naproxen").build());
			assertTrue(r.getAlerts().isEmpty());
		}
	}

	@Test
	void inconsistent_reference_data_refuses_to_start() throws Exception {
		write(tmp, "drug_classes.csv", ReferenceFixtures.DRUGS);
		write(tmp, "interactions.csv", ReferenceFixtures.INTERACTIONS + "\nDDI-2,warfarin,nosuchdrug,major,,,,,");
		write(tmp, "contraindications.csv", ReferenceFixtures.CONTRAINDICATIONS);
		write(tmp, "cross_allergies.csv", ReferenceFixtures.CROSS_ALLERGIES);
		Properties p = baseProps();
		p.setProperty("REFERENCE_DATA_PATH", tmp.toString());

		DataLoadException ex = assertThrows(DataLoadException.class, () -> DrugSafetyEngine.start(new ConfigLoader(p)));
		assertTrue(ex.getIssues().stream().anyMatch(i -> i.contains("nosuchdrug")), () -> ex.getIssues().toString());
	}

	@Test
	void invalid_configuration_refuses_to_start() {
		Properties p = baseProps();
		p.setProperty("REFERENCE_DATA_PATH", tmp.resolve("missing").toString());

		IllegalStateException ex = assertThrows(IllegalStateException.class,
				() -> DrugSafetyEngine.start(new ConfigLoader(p)));
		assertTrue(ex.getMessage().startsWith("Invalid configuration"));
	}

	@Test
	void unusable_timeout_starts_with_the_default() throws Exception {
		for (String raw : List.of("abc", "-5")) {
			Properties p = new Properties();
			p.setProperty("CHECK_TIMEOUT_MS", raw);

			try (DrugSafetyEngine engine = DrugSafetyEngine.start(new ConfigLoader(p))) {
				assertEquals(ConfigLoader.DEFAULT_CHECK_TIMEOUT_MS, engine.getTimeout().toMillis(), raw);
			}
		}
	}

	@Test
	void unknown_duplicate_therapy_classes_are_listed() throws Exception {
		assertEquals(List.of("nsiad"),
				DrugSafetyEngine.unknownClassTags(ReferenceFixtures.bundled(), List.of("nsaid", "nsiad", "statin")));
		assertTrue(DrugSafetyEngine
				.unknownClassTags(ReferenceFixtures.bundled(), new ConfigLoader().getDuplicateTherapyClasses())
				.isEmpty());
	}

	// --- override workflow ---------------------------------------------------

	@Test
	void check_override_and_save() throws Exception {
		ConfigLoader cfg = new ConfigLoader(baseProps());
		try (DrugSafetyEngine engine = DrugSafetyEngine.create(ReferenceFixtures.bundled(), cfg, new OverrideLedger())) {
			CheckResult r = engine.check(PrescriptionCheckRequest.builder().newDrug("sertraline")
					.newDrug("metformin").currentDrug("tramadol").condition("ckd_stage4").build());
			OverrideTransaction tx = engine.openTransaction("P-100", "V-7", "RX-42", "dr.menon", r);
			assertFalse(tx.isClearedToSave());

			Alert ci = r.getAlerts(AlertKind.CONTRAINDICATION).get(0);
			assertThrows(MissingReasonException.class,
					() -> engine.recordDecision(tx, ci, OverrideDecision.PROCEEDED, ""));
			engine.recordDecision(tx, ci, OverrideDecision.PROCEEDED, "Consulted specialist");

			for (Alert a : tx.pendingBlockingAlerts()) {
				engine.recordDecision(tx, a, OverrideDecision.PROCEEDED, "Benefit outweighs risk");
			}
			assertTrue(tx.isClearedToSave());
			assertEquals(r.getBlockingAlerts().size(), tx.getRecords().size());
		}
	}

	// --- alternatives --------------------------------------------------------

	@Test
	void safer_alternatives_skip_interacting_drugs() throws Exception {
		ConfigLoader cfg = new ConfigLoader(baseProps());
		try (DrugSafetyEngine engine = DrugSafetyEngine.create(ReferenceFixtures.bundled(), cfg, new OverrideLedger())) {
			CheckResult r = engine.check(PrescriptionCheckRequest.builder().newDrug("glibenclamide")
					.currentDrug("fluconazole").age(70).build());

			Alert geriatric = r.getAlerts(AlertKind.GERIATRIC).get(0);
			assertEquals(List.of("gliclazide", "linagliptin"), geriatric.getDetails().getAlternatives());
			assertEquals(List.of("linagliptin"), engine.saferAlternatives(geriatric, List.of("fluconazole")));
			assertEquals(List.of("gliclazide", "linagliptin"), engine.saferAlternatives(geriatric, List.of()));
		}
	}
}
