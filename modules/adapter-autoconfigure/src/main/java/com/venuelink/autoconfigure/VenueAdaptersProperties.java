package com.venuelink.autoconfigure;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "venue-adapters")
public class VenueAdaptersProperties {
  private Venue cryptocom = new Venue();
  private Venue gemini = new Venue();
  private Mock mock = new Mock();

  public Venue getCryptocom() {
    return cryptocom;
  }

  public void setCryptocom(Venue cryptocom) {
    this.cryptocom = cryptocom;
  }

  public Venue getGemini() {
    return gemini;
  }

  public void setGemini(Venue gemini) {
    this.gemini = gemini;
  }

  public Mock getMock() {
    return mock;
  }

  public void setMock(Mock mock) {
    this.mock = mock;
  }

  public static class Venue {
    private boolean enabled = true;
    private boolean sandbox = false;
    private long timeoutMs = 30000L;
    private boolean testMode = false;
    private String apiKey = "";
    private String apiSecret = "";
    private String apiKeyFile = "";
    private String apiSecretFile = "";
    private RateLimit rateLimit = new RateLimit();

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public boolean isSandbox() {
      return sandbox;
    }

    public void setSandbox(boolean sandbox) {
      this.sandbox = sandbox;
    }

    public long getTimeoutMs() {
      return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
    }

    public boolean isTestMode() {
      return testMode;
    }

    public void setTestMode(boolean testMode) {
      this.testMode = testMode;
    }

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public String getApiSecret() {
      return apiSecret;
    }

    public void setApiSecret(String apiSecret) {
      this.apiSecret = apiSecret;
    }

    public String getApiKeyFile() {
      return apiKeyFile;
    }

    public void setApiKeyFile(String apiKeyFile) {
      this.apiKeyFile = apiKeyFile;
    }

    public String getApiSecretFile() {
      return apiSecretFile;
    }

    public void setApiSecretFile(String apiSecretFile) {
      this.apiSecretFile = apiSecretFile;
    }

    public RateLimit getRateLimit() {
      return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
      this.rateLimit = rateLimit;
    }
  }

  /** Quota overrides; a limit of 0 keeps the venue's published quota for that request class. */
  public static class RateLimit {
    private int publicLimit = 0;
    private int privateLimit = 0;
    private Duration window = Duration.ofMinutes(1);

    public int getPublicLimit() {
      return publicLimit;
    }

    public void setPublicLimit(int publicLimit) {
      this.publicLimit = publicLimit;
    }

    public int getPrivateLimit() {
      return privateLimit;
    }

    public void setPrivateLimit(int privateLimit) {
      this.privateLimit = privateLimit;
    }

    public Duration getWindow() {
      return window;
    }

    public void setWindow(Duration window) {
      this.window = window;
    }
  }

  public static class Mock extends Venue {
    private long minLatencyMs = 10L;
    private long maxLatencyMs = 100L;
    private Long seed;
    private long tickIntervalMs = 1000L;
    private long orderExecutionDelayMs = 100L;
    private long retryDelayMs = 1000L;
    private Failures failures = new Failures();

    public Mock() {
      setApiKey("mock_api_key");
      setApiSecret("mock_api_secret");
    }

    public long getMinLatencyMs() {
      return minLatencyMs;
    }

    public void setMinLatencyMs(long minLatencyMs) {
      this.minLatencyMs = minLatencyMs;
    }

    public long getMaxLatencyMs() {
      return maxLatencyMs;
    }

    public void setMaxLatencyMs(long maxLatencyMs) {
      this.maxLatencyMs = maxLatencyMs;
    }

    public Long getSeed() {
      return seed;
    }

    public void setSeed(Long seed) {
      this.seed = seed;
    }

    public long getTickIntervalMs() {
      return tickIntervalMs;
    }

    public void setTickIntervalMs(long tickIntervalMs) {
      this.tickIntervalMs = tickIntervalMs;
    }

    public long getOrderExecutionDelayMs() {
      return orderExecutionDelayMs;
    }

    public void setOrderExecutionDelayMs(long orderExecutionDelayMs) {
      this.orderExecutionDelayMs = orderExecutionDelayMs;
    }

    public long getRetryDelayMs() {
      return retryDelayMs;
    }

    public void setRetryDelayMs(long retryDelayMs) {
      this.retryDelayMs = retryDelayMs;
    }

    public Failures getFailures() {
      return failures;
    }

    public void setFailures(Failures failures) {
      this.failures = failures;
    }
  }

  public static class Failures {
    private double connection = 0.0d;
    private double authentication = 0.0d;
    private double orderPlacement = 0.0d;
    private double rateLimit = 0.0d;

    public double getConnection() {
      return connection;
    }

    public void setConnection(double connection) {
      this.connection = connection;
    }

    public double getAuthentication() {
      return authentication;
    }

    public void setAuthentication(double authentication) {
      this.authentication = authentication;
    }

    public double getOrderPlacement() {
      return orderPlacement;
    }

    public void setOrderPlacement(double orderPlacement) {
      this.orderPlacement = orderPlacement;
    }

    public double getRateLimit() {
      return rateLimit;
    }

    public void setRateLimit(double rateLimit) {
      this.rateLimit = rateLimit;
    }
  }
}
