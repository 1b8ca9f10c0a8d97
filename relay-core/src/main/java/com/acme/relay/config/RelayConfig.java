package com.acme.relay.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Relay settings: the endpoint pair, retry/backoff tuning, reconnection bounds and housekeeping
 * intervals. Pure POJO - no framework dependencies.
 */
public class RelayConfig {

  public static final String DEFAULT_APOLOGY_TEXT =
      "Sorry, this media could not be forwarded. Please send it as a different format or as text.";

  private String endpointA;
  private String endpointB;
  private String prefixA = "[From A]";
  private String prefixB = "[From B]";

  private int retryAttempts = 3;
  private Duration retryDelay = Duration.ofSeconds(1);
  private Duration maxDelay = Duration.ofSeconds(30);
  private double backoffMultiplier = 2.0;
  private Duration rateLimitDelay = Duration.ofSeconds(1);

  private int maxReconnectAttempts = 5;
  private Duration reconnectBaseDelay = Duration.ofSeconds(1);
  private Duration reconnectMaxDelay = Duration.ofSeconds(30);
  private Duration readyTimeout = Duration.ofMinutes(2);

  private Duration autoSaveInterval = Duration.ofMinutes(1);
  private Duration shutdownGracePeriod = Duration.ofSeconds(1);
  private long memoryThresholdMb = 400;
  private Duration memoryCheckInterval = Duration.ofMinutes(1);

  private Path stateFile = Path.of("bot-state.json");
  private Path sessionDirectory = Path.of("session");
  private String mediaApologyText = DEFAULT_APOLOGY_TEXT;

  public String getEndpointA() {
    return endpointA;
  }

  public void setEndpointA(String endpointA) {
    this.endpointA = endpointA;
  }

  public String getEndpointB() {
    return endpointB;
  }

  public void setEndpointB(String endpointB) {
    this.endpointB = endpointB;
  }

  public String getPrefixA() {
    return prefixA;
  }

  public void setPrefixA(String prefixA) {
    this.prefixA = prefixA;
  }

  public String getPrefixB() {
    return prefixB;
  }

  public void setPrefixB(String prefixB) {
    this.prefixB = prefixB;
  }

  public int getRetryAttempts() {
    return retryAttempts;
  }

  public void setRetryAttempts(int retryAttempts) {
    this.retryAttempts = retryAttempts;
  }

  public Duration getRetryDelay() {
    return retryDelay;
  }

  public void setRetryDelay(Duration retryDelay) {
    this.retryDelay = retryDelay;
  }

  public Duration getMaxDelay() {
    return maxDelay;
  }

  public void setMaxDelay(Duration maxDelay) {
    this.maxDelay = maxDelay;
  }

  public double getBackoffMultiplier() {
    return backoffMultiplier;
  }

  public void setBackoffMultiplier(double backoffMultiplier) {
    this.backoffMultiplier = backoffMultiplier;
  }

  public Duration getRateLimitDelay() {
    return rateLimitDelay;
  }

  public void setRateLimitDelay(Duration rateLimitDelay) {
    this.rateLimitDelay = rateLimitDelay;
  }

  public int getMaxReconnectAttempts() {
    return maxReconnectAttempts;
  }

  public void setMaxReconnectAttempts(int maxReconnectAttempts) {
    this.maxReconnectAttempts = maxReconnectAttempts;
  }

  public Duration getReconnectBaseDelay() {
    return reconnectBaseDelay;
  }

  public void setReconnectBaseDelay(Duration reconnectBaseDelay) {
    this.reconnectBaseDelay = reconnectBaseDelay;
  }

  public Duration getReconnectMaxDelay() {
    return reconnectMaxDelay;
  }

  public void setReconnectMaxDelay(Duration reconnectMaxDelay) {
    this.reconnectMaxDelay = reconnectMaxDelay;
  }

  public Duration getReadyTimeout() {
    return readyTimeout;
  }

  public void setReadyTimeout(Duration readyTimeout) {
    this.readyTimeout = readyTimeout;
  }

  public Duration getAutoSaveInterval() {
    return autoSaveInterval;
  }

  public void setAutoSaveInterval(Duration autoSaveInterval) {
    this.autoSaveInterval = autoSaveInterval;
  }

  public Duration getShutdownGracePeriod() {
    return shutdownGracePeriod;
  }

  public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
    this.shutdownGracePeriod = shutdownGracePeriod;
  }

  public long getMemoryThresholdMb() {
    return memoryThresholdMb;
  }

  public void setMemoryThresholdMb(long memoryThresholdMb) {
    this.memoryThresholdMb = memoryThresholdMb;
  }

  public Duration getMemoryCheckInterval() {
    return memoryCheckInterval;
  }

  public void setMemoryCheckInterval(Duration memoryCheckInterval) {
    this.memoryCheckInterval = memoryCheckInterval;
  }

  public Path getStateFile() {
    return stateFile;
  }

  public void setStateFile(Path stateFile) {
    this.stateFile = stateFile;
  }

  public Path getSessionDirectory() {
    return sessionDirectory;
  }

  public void setSessionDirectory(Path sessionDirectory) {
    this.sessionDirectory = sessionDirectory;
  }

  public String getMediaApologyText() {
    return mediaApologyText;
  }

  public void setMediaApologyText(String mediaApologyText) {
    this.mediaApologyText = mediaApologyText;
  }
}
