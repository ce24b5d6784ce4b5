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

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LoggersTest {

	@AfterEach
	void resetFactory() {
		Loggers.resetLoggerFactory();
	}

	@Test
	void slf4jIsPickedWhenOnClasspath() {
		Loggers.resetLoggerFactory();

		Logger logger = Loggers.getLogger(LoggersTest.class);

		assertThat(logger).isInstanceOf(Loggers.Slf4JLogger.class);
		assertThat(logger.getName()).isEqualTo(LoggersTest.class.getName());
	}

	@Test
	void jdkLoggersCanBeForced() {
		Loggers.useJdkLoggers();

		assertThat(Loggers.getLogger("jdk")).isInstanceOf(Loggers.JdkLogger.class);
	}

	@Test
	void consoleLoggersCanBeForced() {
		Loggers.useConsoleLoggers();

		assertThat(Loggers.getLogger("console")).isInstanceOf(Loggers.ConsoleLogger.class);
	}

	@Test
	void customLoggersReceiveTheName() {
		List<String> names = new ArrayList<>();
		Logger mockLogger = mock(Logger.class);
		when(mockLogger.getName()).thenReturn("custom");
		Loggers.useCustomLoggers(name -> {
			names.add(name);
			return mockLogger;
		});

		Logger logger = Loggers.getLogger("some.category");
		logger.warn("hello {}", "world");

		assertThat(names).containsExactly("some.category");
		assertThat(logger.getName()).isEqualTo("custom");
		verify(mockLogger).warn("hello {}", "world");
	}
}
