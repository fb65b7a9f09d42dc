package com.lineguard.backend.service;

import com.oracle.bmc.auth.InstancePrincipalsAuthenticationDetailsProvider;
import com.oracle.bmc.monitoring.MonitoringClient;
import com.oracle.bmc.monitoring.model.Datapoint;
import com.oracle.bmc.monitoring.model.MetricDataDetails;
import com.oracle.bmc.monitoring.model.PostMetricDataDetails;
import com.oracle.bmc.monitoring.requests.PostMetricDataRequest;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Publishes job metrics to OCI Monitoring. Disabled unless
 * {@code oci.monitoring.enabled} is set; publishing failures never reach the
 * caller.
 */
@Service
@Slf4j
public class OciMonitoringService implements MonitoringService {

    private MonitoringClient monitoringClient;

    @Value("${oci.monitoring.compartment-id:}")
    private String compartmentId;

    @Value("${oci.monitoring.namespace:lineguard_alerts}")
    private String namespace;

    @Value("${oci.monitoring.enabled:false}")
    private boolean enabled;

    @PostConstruct
    public void init() {
        if (!enabled) {
            log.info("OCI Monitoring is disabled.");
            return;
        }

        try {
            InstancePrincipalsAuthenticationDetailsProvider provider = InstancePrincipalsAuthenticationDetailsProvider
                    .builder().build();
            monitoringClient = MonitoringClient.builder().build(provider);

            // PostMetricData only works against the telemetry ingestion endpoint
            String region = provider.getRegion().getRegionId();
            String endpoint = String.format("https://telemetry-ingestion.%s.oraclecloud.com", region);
            monitoringClient.setEndpoint(endpoint);

            log.info("OCI Monitoring Client initialized (Region: {}, Endpoint: {})", region, endpoint);
        } catch (Exception e) {
            log.error("Failed to initialize OCI Monitoring Client. Metrics will not be exported.", e);
            enabled = false;
        }
    }

    @Override
    public void recordJobDuration(String job, long durationMs, String status) {
        if (!enabled)
            return;

        postMetrics(List.of(metric("JobDuration", durationMs, "milliseconds",
                Map.of("job", job, "status", status))));
    }

    @Override
    public void recordAlertCounts(int sent, int suppressed, int errors) {
        if (!enabled)
            return;

        List<MetricDataDetails> metrics = new ArrayList<>();
        metrics.add(metric("AlertsSent", sent, "count", Map.of("job", "alerts")));
        metrics.add(metric("AlertsSuppressed", suppressed, "count", Map.of("job", "alerts")));
        metrics.add(metric("RouteErrors", errors, "count", Map.of("job", "alerts")));
        postMetrics(metrics);
    }

    static String sanitizeNamespace(String namespace) {
        // OCI requires ^[a-z][a-z0-9_]*[a-z0-9]$
        String sanitized = namespace.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        if (!sanitized.isEmpty() && !Character.isLetter(sanitized.charAt(0))) {
            sanitized = "n_" + sanitized;
        }
        return sanitized;
    }

    private MetricDataDetails metric(String name, double value, String unit, Map<String, String> dimensions) {
        return MetricDataDetails.builder()
                .namespace(sanitizeNamespace(namespace))
                .compartmentId(compartmentId)
                .name(name)
                .metadata(Collections.singletonMap("unit", unit))
                .dimensions(dimensions)
                .datapoints(Collections.singletonList(
                        Datapoint.builder()
                                .timestamp(new Date())
                                .value(value)
                                .count(1)
                                .build()))
                .build();
    }

    private void postMetrics(List<MetricDataDetails> metrics) {
        try {
            PostMetricDataRequest request = PostMetricDataRequest.builder()
                    .postMetricDataDetails(PostMetricDataDetails.builder()
                            .metricData(metrics)
                            .build())
                    .build();

            monitoringClient.postMetricData(request);
            log.debug("Published {} metrics to OCI namespace {}", metrics.size(), sanitizeNamespace(namespace));
        } catch (Exception e) {
            log.warn("Failed to publish metrics to OCI. Namespace: {}. Error: {}", sanitizeNamespace(namespace),
                    e.getMessage());
        }
    }

    @PreDestroy
    public void close() {
        if (monitoringClient != null) {
            monitoringClient.close();
        }
    }
}
