package org.rxsafe.rules.reference;

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

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.rxsafe.rules.conf.ConfigLoader;

import lombok.Value;

/**
 * Locations of the four reference files. Each source is opened once by
 * {@link ReferenceDataLoader}; the engine never writes to them.
 */
@Value
public class ReferenceSources {

	/** Opens a fresh reader over one reference file. */
	@FunctionalInterface
	public interface Opener {
		Reader open() throws IOException;
	}

	/** A named, openable reference file. */
	@Value
	public static class Source {
		String name;
		Opener opener;

		public Reader open() throws IOException {
			return opener.open();
		}

		public static Source ofFile(Path file) {
			return new Source(file.toString(), () -> Files.newBufferedReader(file, StandardCharsets.UTF_8));
		}

		public static Source ofClasspath(String resource) {
			return new Source("classpath:" + resource, () -> {
				InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource);
				if (in == null) {
					in = ReferenceSources.class.getClassLoader().getResourceAsStream(resource);
				}
				if (in == null) {
					throw new FileNotFoundException("classpath resource not found: " + resource);
				}
				return new InputStreamReader(in, StandardCharsets.UTF_8);
			});
		}

		public static Source ofText(String name, String content) {
			return new Source(name, () -> new StringReader(content));
		}
	}

	Source drugClasses;
	Source interactions;
	Source contraindications;
	Source crossAllergies;

	/** Default file names under a directory. */
	public static ReferenceSources fromDirectory(Path dir) {
		return new ReferenceSources(Source.ofFile(dir.resolve(ConfigLoader.DEFAULT_DRUG_CLASSES_FILE)),
				Source.ofFile(dir.resolve(ConfigLoader.DEFAULT_INTERACTIONS_FILE)),
				Source.ofFile(dir.resolve(ConfigLoader.DEFAULT_CONTRAINDICATIONS_FILE)),
				Source.ofFile(dir.resolve(ConfigLoader.DEFAULT_CROSS_ALLERGIES_FILE)));
	}

	/** Default file names under a classpath directory such as {@code reference/}. */
	public static ReferenceSources fromClasspath(String prefix) {
		String p = prefix.endsWith("/") ? prefix : prefix + "/";
		return new ReferenceSources(Source.ofClasspath(p + ConfigLoader.DEFAULT_DRUG_CLASSES_FILE),
				Source.ofClasspath(p + ConfigLoader.DEFAULT_INTERACTIONS_FILE),
				Source.ofClasspath(p + ConfigLoader.DEFAULT_CONTRAINDICATIONS_FILE),
				Source.ofClasspath(p + ConfigLoader.DEFAULT_CROSS_ALLERGIES_FILE));
	}

	/**
	 * Sources named by the configuration: the configured directory and file
	 * names, or the bundled classpath data when no directory is set.
	 */
	public static ReferenceSources fromConfig(ConfigLoader cfg) {
		return cfg.getReferenceDataPath().map(dir -> new ReferenceSources(
				Source.ofFile(dir.resolve(cfg.getDrugClassesFile())),
				Source.ofFile(dir.resolve(cfg.getInteractionsFile())),
				Source.ofFile(dir.resolve(cfg.getContraindicationsFile())),
				Source.ofFile(dir.resolve(cfg.getCrossAllergiesFile()))))
				.orElseGet(() -> fromClasspath(ConfigLoader.DEFAULT_REFERENCE_RESOURCE));
	}
}
