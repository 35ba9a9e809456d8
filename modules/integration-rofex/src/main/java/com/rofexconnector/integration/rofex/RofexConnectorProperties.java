package com.rofexconnector.integration.rofex;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "connector.rofex")
public class RofexConnectorProperties {
  private Environment environment = Environment.REMARKET;
  private String user = "";
  private String password = "";
  private String passwordFile = "";
  private String activeToken = "";
  private String activeTokenFile = "";
  private String account = "";
  private String proprietary = "";
  private String restBaseUrl = "";
  private String wsBaseUrl = "";
  private long requestTimeoutMs = 10000L;
  private long connectionTimeoutMs = 5000L;
  private long heartbeatIntervalMs = 30000L;
  private Stream stream = new Stream();

  public Environment getEnvironment() {
    return environment;
  }

  public void setEnvironment(Environment environment) {
    this.environment = environment;
  }

  public String getUser() {
    return user;
  }

  public void setUser(String user) {
    this.user = user;
  }

  public String getPassword() {
    return password;
  }

  public void setPassword(String password) {
    this.password = password;
  }

  public String getPasswordFile() {
    return passwordFile;
  }

  public void setPasswordFile(String passwordFile) {
    this.passwordFile = passwordFile;
  }

  public String getActiveToken() {
    return activeToken;
  }

  public void setActiveToken(String activeToken) {
    this.activeToken = activeToken;
  }

  public String getActiveTokenFile() {
    return activeTokenFile;
  }

  public void setActiveTokenFile(String activeTokenFile) {
    this.activeTokenFile = activeTokenFile;
  }

  public String getAccount() {
    return account;
  }

  public void setAccount(String account) {
    this.account = account;
  }

  public String getProprietary() {
    return proprietary;
  }

  public void setProprietary(String proprietary) {
    this.proprietary = proprietary;
  }

  public String getRestBaseUrl() {
    return restBaseUrl;
  }

  public void setRestBaseUrl(String restBaseUrl) {
    this.restBaseUrl = restBaseUrl;
  }

  public String getWsBaseUrl() {
    return wsBaseUrl;
  }

  public void setWsBaseUrl(String wsBaseUrl) {
    this.wsBaseUrl = wsBaseUrl;
  }

  public long getRequestTimeoutMs() {
    return requestTimeoutMs;
  }

  public void setRequestTimeoutMs(long requestTimeoutMs) {
    this.requestTimeoutMs = requestTimeoutMs;
  }

  public long getConnectionTimeoutMs() {
    return connectionTimeoutMs;
  }

  public void setConnectionTimeoutMs(long connectionTimeoutMs) {
    this.connectionTimeoutMs = connectionTimeoutMs;
  }

  public long getHeartbeatIntervalMs() {
    return heartbeatIntervalMs;
  }

  public void setHeartbeatIntervalMs(long heartbeatIntervalMs) {
    this.heartbeatIntervalMs = heartbeatIntervalMs;
  }

  public Stream getStream() {
    return stream;
  }

  public void setStream(Stream stream) {
    this.stream = stream;
  }

  public static class Stream {
    private boolean enabled = false;
    private List<String> tickers = new ArrayList<>();
    private List<MarketDataEntry> entries = new ArrayList<>();
    private int depth = 1;
    private Market market = Market.ROFEX;
    private boolean orderReportsEnabled = false;
    private boolean snapshotOnlyActive = true;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public List<String> getTickers() {
      return tickers;
    }

    public void setTickers(List<String> tickers) {
      this.tickers = tickers;
    }

    public List<MarketDataEntry> getEntries() {
      return entries;
    }

    public void setEntries(List<MarketDataEntry> entries) {
      this.entries = entries;
    }

    public int getDepth() {
      return depth;
    }

    public void setDepth(int depth) {
      this.depth = depth;
    }

    public Market getMarket() {
      return market;
    }

    public void setMarket(Market market) {
      this.market = market;
    }

    public boolean isOrderReportsEnabled() {
      return orderReportsEnabled;
    }

    public void setOrderReportsEnabled(boolean orderReportsEnabled) {
      this.orderReportsEnabled = orderReportsEnabled;
    }

    public boolean isSnapshotOnlyActive() {
      return snapshotOnlyActive;
    }

    public void setSnapshotOnlyActive(boolean snapshotOnlyActive) {
      this.snapshotOnlyActive = snapshotOnlyActive;
    }
  }
}
