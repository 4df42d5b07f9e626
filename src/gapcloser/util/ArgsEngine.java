/*
 * Args - A Reusable Solution for Command Line Arguments Parsing in Java
 *
 * Copyright 2008 Adarsh Ramamurthy
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Web site: http://www.adarshr.com/papers/args
 */
package gapcloser.util;

import java.util.HashMap;
import java.util.Map;

/**
 * Command line option parsing. Options are registered as short/long pairs, either
 * as flags or as options taking the next argument as value.
 *
 * <pre>
 * ArgsEngine engine = new ArgsEngine();
 * engine.add("-r", "--reference", true);
 * engine.add("-het", "--heterozygous");
 * engine.parse(args);
 *
 * String reference = engine.getRequired("-r", "Please specify the reference.");
 * int threads = engine.getInt("-t", 1);
 * boolean het = engine.getBoolean("-het");
 * </pre>
 *
 * Modified from the original: values are typed and malformed input is reported as
 * {@link ConfigurationException}.
 *
 * @author Adarsh Ramamurthy
 */
public class ArgsEngine {

	private final Map<String, Option> options = new HashMap<String, Option>();
	private boolean parseCalled = false;

	public void add(String shortForm, String longForm) {
		this.add(shortForm, longForm, false);
	}

	/**
	 * @param valued whether the option takes the following argument as its value
	 */
	public void add(String shortForm, String longForm, boolean valued) {
		Option option = new Option(valued);
		this.options.put(shortForm, option);
		this.options.put(longForm, option);
	}

	public void parse(String[] args) {
		this.parseCalled = true;

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			Option option = this.options.get(arg);
			if (arg.startsWith("-") && option != null) {
				if (option.valued) {
					if (i + 1 >= args.length) {
						throw new ConfigurationException("Value required for option "+arg);
					}
					option.value = args[++i];
				} else {
					option.value = "not-null";
				}
			} else {
				throw new ConfigurationException("Unrecognized option "+arg);
			}
		}
	}

	/**
	 * @return the value of a valued option, <tt>null</tt> if absent or a flag
	 */
	public String getString(String key) {
		Option option = this.lookup(key);
		return option != null && option.valued ? option.value : null;
	}

	/**
	 * @return <tt>true</tt> if the option was given
	 */
	public boolean getBoolean(String key) {
		Option option = this.lookup(key);
		return option != null && option.value != null;
	}

	public String getRequired(String key, String message) {
		String value = this.getString(key);
		if (value == null) throw new ConfigurationException(message);
		return value;
	}

	public int getInt(String key, int defaultValue) {
		String value = this.getString(key);
		if (value == null) return defaultValue;
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new ConfigurationException("Option "+key+" expects an integer, got "+value, e);
		}
	}

	public double getDouble(String key, double defaultValue) {
		String value = this.getString(key);
		if (value == null) return defaultValue;
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException e) {
			throw new ConfigurationException("Option "+key+" expects a number, got "+value, e);
		}
	}

	private Option lookup(String key) {
		if (!this.parseCalled) {
			throw new IllegalStateException("Method parse not invoked");
		}
		return this.options.get(key);
	}

	private static class Option {
		private final boolean valued;
		private String value;

		private Option(boolean valued) {
			this.valued = valued;
		}
	}
}
