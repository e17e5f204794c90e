/**
 * Phaedra II
 *
 * Copyright (C) 2016-2025 Open Analytics
 *
 * ===========================================================================
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the Apache License as published by
 * The Apache Software Foundation, either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * Apache License for more details.
 *
 * You should have received a copy of the Apache License
 * along with this program.  If not, see <http://www.apache.org/licenses/>
 */
package eu.openanalytics.phaedra.sampletrackingservice.config;

import eu.openanalytics.phaedra.sampletrackingservice.sequence.CounterName;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@NoArgsConstructor @Getter @Setter
@Configuration
@ConfigurationProperties(prefix = "phaedra.sample-tracking")
public class SampleTrackingProperties {

	private CounterSettings caseCounter = new CounterSettings("25", 3, null, null);
	private CounterSettings specimenCounter = new CounterSettings("25", 3, null, null);
	private CounterSettings amplificationBatchCounter = new CounterSettings("LDS", 1, null, 1L);
	private CounterSettings separationBatchCounter = new CounterSettings("ELEC", 1, null, 1L);
	private CounterSettings rerunBatchCounter = new CounterSettings("LDS", 1, "RR", 1L);

	private PlateSettings plate = new PlateSettings();
	private QueueSettings queue = new QueueSettings();
	private StatisticsSettings statistics = new StatisticsSettings();

	public CounterSettings getCounter(String counterName) {
		return switch (CounterName.fromName(counterName)) {
			case CASE -> caseCounter;
			case SPECIMEN -> specimenCounter;
			case AMPLIFICATION_BATCH -> amplificationBatchCounter;
			case SEPARATION_BATCH -> separationBatchCounter;
			case RERUN_BATCH -> rerunBatchCounter;
		};
	}

	/**
	 * Rendering of one counter. A non-null {@code start} initializes the counter at startup.
	 */
	@NoArgsConstructor @AllArgsConstructor @Getter @Setter
	public static class CounterSettings {
		private String prefix;
		private int width = 3;
		private String suffix;
		private Long start;
	}

	@NoArgsConstructor @Getter @Setter
	public static class PlateSettings {
		private String allelicLadderPosition = "A1";
		private String positiveControlPosition = "A2";
		private String negativeControlPosition = "H12";
	}

	@NoArgsConstructor @Getter @Setter
	public static class QueueSettings {
		private int minimumBatchSize = 8;
	}

	@NoArgsConstructor @Getter @Setter
	public static class StatisticsSettings {
		private int bottleneckThreshold = 20;
		private int highSeverityThreshold = 50;
	}
}
