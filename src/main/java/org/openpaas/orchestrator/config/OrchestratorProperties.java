/*
 * Copyright 2024-2026 The OpenPaaS Orchestrator Authors
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
 */

package org.openpaas.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;

/**
 * Configuration properties for the deployment workflow engine.
 *
 * <p>Example YAML:
 * <pre>{@code
 * openpaas:
 *   orchestrator:
 *     workflow:
 *       event-source: workflow-engine
 *     side-effects:
 *       max-concurrent-lanes: 64
 *     cleanup:
 *       enabled: true
 *       interval: 1h
 *       retention: 24h
 *     watchdog:
 *       enabled: false
 *       build-timeout: 30m
 *       deploy-timeout: 15m
 *     event-bus:
 *       provider: in-memory
 *       publish-timeout: 10s
 *       request-timeout: 30s
 *       streams:
 *         max-age: 7d
 *         max-bytes: 1073741824
 *       nats:
 *         url: nats://localhost:4222
 *         jet-stream-enabled: true
 *     scheduling:
 *       thread-pool-size: 2
 * }</pre>
 */
@ConfigurationProperties(prefix = "openpaas.orchestrator")
public class OrchestratorProperties {

    @NestedConfigurationProperty
    private WorkflowProperties workflow = new WorkflowProperties();

    @NestedConfigurationProperty
    private SideEffectProperties sideEffects = new SideEffectProperties();

    @NestedConfigurationProperty
    private CleanupProperties cleanup = new CleanupProperties();

    @NestedConfigurationProperty
    private WatchdogProperties watchdog = new WatchdogProperties();

    @NestedConfigurationProperty
    private EventBusProperties eventBus = new EventBusProperties();

    @NestedConfigurationProperty
    private SchedulingProperties scheduling = new SchedulingProperties();

    @NestedConfigurationProperty
    private HealthProperties health = new HealthProperties();

    @NestedConfigurationProperty
    private MetricsProperties metrics = new MetricsProperties();

    @NestedConfigurationProperty
    private DlqProperties dlq = new DlqProperties();

    @NestedConfigurationProperty
    private ResilienceProperties resilience = new ResilienceProperties();

    // --- Getters and Setters ---

    public WorkflowProperties getWorkflow() { return workflow; }
    public void setWorkflow(WorkflowProperties workflow) { this.workflow = workflow; }

    public SideEffectProperties getSideEffects() { return sideEffects; }
    public void setSideEffects(SideEffectProperties sideEffects) { this.sideEffects = sideEffects; }

    public CleanupProperties getCleanup() { return cleanup; }
    public void setCleanup(CleanupProperties cleanup) { this.cleanup = cleanup; }

    public WatchdogProperties getWatchdog() { return watchdog; }
    public void setWatchdog(WatchdogProperties watchdog) { this.watchdog = watchdog; }

    public EventBusProperties getEventBus() { return eventBus; }
    public void setEventBus(EventBusProperties eventBus) { this.eventBus = eventBus; }

    public SchedulingProperties getScheduling() { return scheduling; }
    public void setScheduling(SchedulingProperties scheduling) { this.scheduling = scheduling; }

    public HealthProperties getHealth() { return health; }
    public void setHealth(HealthProperties health) { this.health = health; }

    public MetricsProperties getMetrics() { return metrics; }
    public void setMetrics(MetricsProperties metrics) { this.metrics = metrics; }

    public DlqProperties getDlq() { return dlq; }
    public void setDlq(DlqProperties dlq) { this.dlq = dlq; }

    public ResilienceProperties getResilience() { return resilience; }
    public void setResilience(ResilienceProperties resilience) { this.resilience = resilience; }

    // --- Nested property classes ---

    public static class WorkflowProperties {
        private String eventSource = "workflow-engine";

        public String getEventSource() { return eventSource; }
        public void setEventSource(String eventSource) { this.eventSource = eventSource; }
    }

    public static class SideEffectProperties {
        private int maxConcurrentLanes = 64;

        public int getMaxConcurrentLanes() { return maxConcurrentLanes; }
        public void setMaxConcurrentLanes(int maxConcurrentLanes) { this.maxConcurrentLanes = maxConcurrentLanes; }
    }

    public static class CleanupProperties {
        private boolean enabled = true;
        private Duration interval = Duration.ofHours(1);
        private Duration retention = Duration.ofHours(24);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }

        public Duration getRetention() { return retention; }
        public void setRetention(Duration retention) { this.retention = retention; }
    }

    public static class WatchdogProperties {
        private boolean enabled = false;
        private Duration interval = Duration.ofMinutes(1);
        private Duration buildTimeout = Duration.ofMinutes(30);
        private Duration deployTimeout = Duration.ofMinutes(15);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }

        public Duration getBuildTimeout() { return buildTimeout; }
        public void setBuildTimeout(Duration buildTimeout) { this.buildTimeout = buildTimeout; }

        public Duration getDeployTimeout() { return deployTimeout; }
        public void setDeployTimeout(Duration deployTimeout) { this.deployTimeout = deployTimeout; }
    }

    public static class EventBusProperties {
        private String provider = "in-memory";
        private Duration publishTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);

        @NestedConfigurationProperty
        private StreamProperties streams = new StreamProperties();

        @NestedConfigurationProperty
        private NatsProperties nats = new NatsProperties();

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public Duration getPublishTimeout() { return publishTimeout; }
        public void setPublishTimeout(Duration publishTimeout) { this.publishTimeout = publishTimeout; }

        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

        public StreamProperties getStreams() { return streams; }
        public void setStreams(StreamProperties streams) { this.streams = streams; }

        public NatsProperties getNats() { return nats; }
        public void setNats(NatsProperties nats) { this.nats = nats; }
    }

    public static class StreamProperties {
        private Duration maxAge = Duration.ofDays(7);
        private long maxBytes = 1024L * 1024 * 1024;
        private long maxMessages = -1;
        private int replicas = 1;
        private boolean fileStorage = true;

        public Duration getMaxAge() { return maxAge; }
        public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }

        public long getMaxBytes() { return maxBytes; }
        public void setMaxBytes(long maxBytes) { this.maxBytes = maxBytes; }

        public long getMaxMessages() { return maxMessages; }
        public void setMaxMessages(long maxMessages) { this.maxMessages = maxMessages; }

        public int getReplicas() { return replicas; }
        public void setReplicas(int replicas) { this.replicas = replicas; }

        public boolean isFileStorage() { return fileStorage; }
        public void setFileStorage(boolean fileStorage) { this.fileStorage = fileStorage; }
    }

    public static class NatsProperties {
        private String url = "nats://localhost:4222";
        private String connectionName = "platform-orchestrator";
        private int maxReconnects = 60;
        private Duration reconnectWait = Duration.ofSeconds(2);
        private Duration connectionTimeout = Duration.ofSeconds(5);
        private Duration drainTimeout = Duration.ofSeconds(10);
        private String token;
        private String username;
        private String password;
        private boolean jetStreamEnabled = true;
        private int replayBatchSize = 256;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getConnectionName() { return connectionName; }
        public void setConnectionName(String connectionName) { this.connectionName = connectionName; }

        public int getMaxReconnects() { return maxReconnects; }
        public void setMaxReconnects(int maxReconnects) { this.maxReconnects = maxReconnects; }

        public Duration getReconnectWait() { return reconnectWait; }
        public void setReconnectWait(Duration reconnectWait) { this.reconnectWait = reconnectWait; }

        public Duration getConnectionTimeout() { return connectionTimeout; }
        public void setConnectionTimeout(Duration connectionTimeout) { this.connectionTimeout = connectionTimeout; }

        public Duration getDrainTimeout() { return drainTimeout; }
        public void setDrainTimeout(Duration drainTimeout) { this.drainTimeout = drainTimeout; }

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public boolean isJetStreamEnabled() { return jetStreamEnabled; }
        public void setJetStreamEnabled(boolean jetStreamEnabled) { this.jetStreamEnabled = jetStreamEnabled; }

        public int getReplayBatchSize() { return replayBatchSize; }
        public void setReplayBatchSize(int replayBatchSize) { this.replayBatchSize = replayBatchSize; }
    }

    public static class SchedulingProperties {
        private int threadPoolSize = 2;

        public int getThreadPoolSize() { return threadPoolSize; }
        public void setThreadPoolSize(int threadPoolSize) { this.threadPoolSize = threadPoolSize; }
    }

    public static class HealthProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class MetricsProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class DlqProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class ResilienceProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
