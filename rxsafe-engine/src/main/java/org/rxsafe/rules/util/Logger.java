package org.rxsafe.rules.util;

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

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Locale;

/**
 * Console logger for the rule engine.
 *
 * <p>
 * Each line reads {@code <timestamp> <LEVEL> [<thread>] <message>}. INFO and
 * below go to the out stream, WARN and ERROR to the err stream. A throwable
 * logged at WARN is summarised as its cause chain on one line; at ERROR the
 * full stack trace follows.
 * </p>
 *
 * <p>
 * System properties read once at class load:
 * </p>
 * <ul>
 * <li><b>rxsafe.log.level</b> minimum level to print (default INFO)</li>
 * <li><b>rxsafe.log.datetime</b> timestamp pattern (default
 * yyyy-MM-dd HH:mm:ss)</li>
 * </ul>
 *
 * <p>
 * Callers log drug names, condition identifiers and rule ids only. Patient
 * identity never reaches this class.
 * </p>
 */
public final class Logger {

	public enum Level {
		TRACE, DEBUG, INFO, WARN, ERROR;

		static Level parse(String s, Level fallback) {
			if (s == null || s.isBlank())
				return fallback;
			try {
				return Level.valueOf(s.trim().toUpperCase(Locale.ROOT));
			} catch (IllegalArgumentException ex) {
				return fallback;
			}
		}
	}

	private static final DateTimeFormatter TS = DateTimeFormatter
			.ofPattern(System.getProperty("rxsafe.log.datetime", "yyyy-MM-dd HH:mm:ss"));

	private static volatile Level minLevel = Level.parse(System.getProperty("rxsafe.log.level"), Level.INFO);
	private static volatile PrintStream out = System.out;
	private static volatile PrintStream err = System.err;

	private Logger() {
	}

	/** True when messages at {@code level} would be printed. */
	public static boolean isEnabled(Level level) {
		return level.ordinal() >= minLevel.ordinal();
	}

	public static Level getLevel() {
		return minLevel;
	}

	/** Change the minimum level at runtime, e.g. to trace a single check. */
	public static void setLevel(Level level) {
		minLevel = level == null ? Level.INFO : level;
	}

	/**
	 * Send output to the given streams instead of the console. Passing null
	 * restores the corresponding console stream.
	 */
	public static void redirect(PrintStream outStream, PrintStream errStream) {
		out = outStream == null ? System.out : outStream;
		err = errStream == null ? System.err : errStream;
	}

	public static void trace(String msg, Object... args) {
		log(Level.TRACE, null, msg, args);
	}

	public static void debug(String msg, Object... args) {
		log(Level.DEBUG, null, msg, args);
	}

	public static void info(String msg, Object... args) {
		log(Level.INFO, null, msg, args);
	}

	public static void warn(String msg, Object... args) {
		log(Level.WARN, null, msg, args);
	}

	public static void warn(String msg, Throwable t, Object... args) {
		log(Level.WARN, t, msg, args);
	}

	public static void error(String msg, Object... args) {
		log(Level.ERROR, null, msg, args);
	}

	public static void error(String msg, Throwable t, Object... args) {
		log(Level.ERROR, t, msg, args);
	}

	private static void log(Level level, Throwable t, String msg, Object... args) {
		if (!isEnabled(level))
			return;

		StringBuilder line = new StringBuilder(64);
		line.append(LocalDateTime.now().format(TS)).append(' ').append(String.format("%-5s", level)).append(" [")
				.append(Thread.currentThread().getName()).append("] ").append(format(msg, args));
		if (t != null && level == Level.WARN) {
			line.append(" (").append(causeChain(t)).append(')');
		}

		PrintStream target = level.ordinal() >= Level.WARN.ordinal() ? err : out;
		synchronized (Logger.class) {
			target.println(line);
			if (t != null && level == Level.ERROR) {
				t.printStackTrace(target);
			}
		}
	}

	/** {@code Type: message <- Type: message} from outermost to root cause. */
	static String causeChain(Throwable t) {
		StringBuilder sb = new StringBuilder();
		int depth = 0;
		for (Throwable c = t; c != null && depth < 8; c = c.getCause(), depth++) {
			if (depth > 0) {
				sb.append(" <- ");
			}
			sb.append(c.getClass().getSimpleName());
			if (c.getMessage() != null) {
				sb.append(": ").append(c.getMessage());
			}
			if (c.getCause() == c) {
				break;
			}
		}
		return sb.toString();
	}

	/**
	 * Substitutes each {@code {}} with the next argument. Arrays are rendered
	 * element by element. Surplus arguments are appended, unfilled
	 * placeholders kept.
	 */
	static String format(String template, Object... args) {
		if (template == null)
			return "null";
		if (args == null || args.length == 0)
			return template;

		StringBuilder sb = new StringBuilder(template.length() + args.length * 8);
		int argIdx = 0;
		int from = 0;
		int at;
		while (argIdx < args.length && (at = template.indexOf("{}", from)) >= 0) {
			sb.append(template, from, at).append(render(args[argIdx++]));
			from = at + 2;
		}
		sb.append(template, from, template.length());
		while (argIdx < args.length) {
			sb.append(' ').append(render(args[argIdx++]));
		}
		return sb.toString();
	}

	private static String render(Object arg) {
		if (arg instanceof Object[]) {
			return Arrays.deepToString((Object[]) arg);
		}
		return String.valueOf(arg);
	}
}
