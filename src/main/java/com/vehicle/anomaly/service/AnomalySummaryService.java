package com.vehicle.anomaly.service;

import com.vehicle.anomaly.model.AnomalyRecord;
import com.vehicle.anomaly.model.AnomalySummary;
import com.vehicle.anomaly.model.AnomalyType;
import com.vehicle.anomaly.model.Severity;
import com.vehicle.anomaly.repository.AnomalyRecordRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Aggregates the persisted anomalies of one session over a recent window.
 */
@Service
public class AnomalySummaryService {

    static final int TOP_PARAMETERS = 5;
    static final int MAX_RECOMMENDATIONS = 5;

    private final AnomalyRecordRepository recordRepository;
    private final Clock clock;

    public AnomalySummaryService(AnomalyRecordRepository recordRepository, Clock clock) {
        this.recordRepository = recordRepository;
        this.clock = clock;
    }

    /**
     * @param hoursBack window length ending now, must be positive
     */
    public AnomalySummary getAnomalySummary(String sessionId, int hoursBack) {
        if (hoursBack <= 0) {
            throw new IllegalArgumentException("hoursBack must be positive, got " + hoursBack);
        }
        long since = clock.instant().minus(Duration.ofHours(hoursBack)).toEpochMilli();
        List<AnomalyRecord> records = recordRepository.findBySessionId(sessionId, since);

        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity.code(), 0);
        }
        Map<String, Integer> byType = new LinkedHashMap<>();
        for (AnomalyType type : AnomalyType.values()) {
            byType.put(type.code(), 0);
        }
        Map<String, Integer> byParameter = new LinkedHashMap<>();
        Map<String, Integer> urgentActions = new LinkedHashMap<>();

        for (AnomalyRecord record : records) {
            bySeverity.merge(record.getSeverity().code(), 1, Integer::sum);
            byType.merge(record.getAnomalyType().code(), 1, Integer::sum);
            byParameter.merge(record.getParameterName(), 1, Integer::sum);
            if (isUrgent(record.getSeverity()) && record.getRecommendedAction() != null) {
                urgentActions.merge(record.getRecommendedAction(), 1, Integer::sum);
            }
        }

        return AnomalySummary.builder()
                .sessionId(sessionId)
                .timePeriodHours(hoursBack)
                .totalAnomalies(records.size())
                .severityBreakdown(bySeverity)
                .anomalyTypes(byType)
                .mostAffectedParameters(topParameters(byParameter))
                .recommendations(topKeys(urgentActions, MAX_RECOMMENDATIONS))
                .build();
    }

    private static boolean isUrgent(Severity severity) {
        return severity == Severity.HIGH || severity == Severity.CRITICAL;
    }

    // Most frequent first, ties by name
    private static List<AnomalySummary.ParameterCount> topParameters(Map<String, Integer> counts) {
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.<String, Integer>comparingByKey()))
                .limit(TOP_PARAMETERS)
                .map(e -> new AnomalySummary.ParameterCount(e.getKey(), e.getValue()))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static List<String> topKeys(Map<String, Integer> counts, int limit) {
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(limit)
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
