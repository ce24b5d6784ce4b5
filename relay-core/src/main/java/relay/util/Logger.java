/*
 * Copyright (c) 2016-2024 VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package relay.util;

/**
 * Logger interface designed for internal Relay usage. Obtain instances through
 * {@link Loggers#getLogger(Class)}.
 */
public interface Logger {

	/**
	 * Return the name of this <code>Logger</code> instance.
	 * @return name of this logger instance
	 */
	String getName();

	/**
	 * Is the logger instance enabled for the DEBUG level?
	 *
	 * @return True if this Logger is enabled for the DEBUG level,
	 *         false otherwise.
	 */
	boolean isDebugEnabled();

	/**
	 * Log a message at the DEBUG level.
	 *
	 * @param msg the message string to be logged
	 */
	void debug(String msg);

	/**
	 * Log a message at the DEBUG level according to the specified format
	 * and arguments. The format uses SLF4J-style {@code {}} placeholders.
	 *
	 * @param format    the format string
	 * @param arguments a list of arguments
	 */
	void debug(String format, Object... arguments);

	/**
	 * Log a message at the INFO level according to the specified format
	 * and arguments.
	 *
	 * @param format    the format string
	 * @param arguments a list of arguments
	 */
	void info(String format, Object... arguments);

	/**
	 * Log a message at the WARN level according to the specified format
	 * and arguments.
	 *
	 * @param format    the format string
	 * @param arguments a list of arguments
	 */
	void warn(String format, Object... arguments);

	/**
	 * Log an exception (throwable) at the WARN level with an
	 * accompanying message.
	 *
	 * @param msg the message accompanying the exception
	 * @param t   the exception (throwable) to log
	 */
	void warn(String msg, Throwable t);

	/**
	 * Log a message at the ERROR level according to the specified format
	 * and arguments.
	 *
	 * @param format    the format string
	 * @param arguments a list of arguments
	 */
	void error(String format, Object... arguments);

	/**
	 * Log an exception (throwable) at the ERROR level with an
	 * accompanying message.
	 *
	 * @param msg the message accompanying the exception
	 * @param t   the exception (throwable) to log
	 */
	void error(String msg, Throwable t);
}
